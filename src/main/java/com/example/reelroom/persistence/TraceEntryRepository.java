package com.example.reelroom.persistence;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TraceEntryRepository extends Repository<TraceEntryEntity, Long> {

    TraceEntryEntity save(TraceEntryEntity e);

    @Query("select e from TraceEntryEntity e where e.traceTime = :tt order by e.id asc")
    List<TraceEntryEntity> findByTraceTime(@Param("tt") long traceTime);

    @Query("select count(e) from TraceEntryEntity e where e.traceTime = :tt")
    long countByTraceTime(@Param("tt") long traceTime);

    @Query("select count(e) from TraceEntryEntity e")
    long countAll();

    @Query("select distinct e.traceTime from TraceEntryEntity e")
    List<Long> findTraceTimes();

    @Query("select coalesce(sum(length(coalesce(e.payloadJson,''))), 0) from TraceEntryEntity e")
    long sumApproxBytes();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TraceEntryEntity e where e.traceTime = :tt")
    int deleteByTraceTime(@Param("tt") long traceTime);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TraceEntryEntity e where e.traceTime < :cutoff")
    int deleteOlderThan(@Param("cutoff") long cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TraceEntryEntity e")
    int deleteAllRows();
}
