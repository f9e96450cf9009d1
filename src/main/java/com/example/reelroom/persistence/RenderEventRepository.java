package com.example.reelroom.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface RenderEventRepository extends Repository<RenderEventEntity, Long> {

    RenderEventEntity save(RenderEventEntity e);

    @Query("select e from RenderEventEntity e where e.traceTime = :tt order by e.id asc")
    List<RenderEventEntity> findByTraceTime(@Param("tt") long traceTime);

    @Query("select count(e) from RenderEventEntity e where e.traceTime = :tt")
    long countByTraceTime(@Param("tt") long traceTime);

    @Query("select count(e) from RenderEventEntity e")
    long countAll();

    @Query("select e.id from RenderEventEntity e where e.traceTime = :tt order by e.tsEpochMs asc, e.id asc")
    List<Long> findIdsOldestFirst(@Param("tt") long traceTime, Pageable pageable);

    @Query("select distinct e.traceTime from RenderEventEntity e")
    List<Long> findTraceTimes();

    @Query("select coalesce(sum(length(coalesce(e.payloadJson,''))), 0) from RenderEventEntity e")
    long sumApproxBytes();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RenderEventEntity e where e.id in :ids")
    int deleteByIds(@Param("ids") List<Long> ids);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RenderEventEntity e where e.traceTime = :tt")
    int deleteByTraceTime(@Param("tt") long traceTime);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RenderEventEntity e where e.traceTime < :cutoff")
    int deleteOlderThan(@Param("cutoff") long cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RenderEventEntity e")
    int deleteAllRows();
}
