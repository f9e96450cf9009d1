package com.example.reelroom.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps HAR members this model has no field for (comments, {@code _custom} extensions, pages
 * references), so an imported entry is written back out unchanged.
 */
public abstract class HarFields {

    private final Map<String, Object> extraFields = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> extraFields() { return extraFields; }

    @JsonAnySetter
    public void putExtraField(String name, Object value) {
        extraFields.put(name, value);
    }
}
