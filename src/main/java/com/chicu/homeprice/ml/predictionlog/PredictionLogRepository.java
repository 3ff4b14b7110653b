package com.chicu.homeprice.ml.predictionlog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Repository
public interface PredictionLogRepository extends JpaRepository<PredictionLogEntry, UUID> {

    /**
     * Атомарное обновление одной строки по ключу.
     * Остальные записи не читаются и не перезаписываются.
     *
     * @return число обновлённых строк (0 = id не найден)
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update PredictionLogEntry e
              set e.realPrice = :realPrice
            where e.id = :id
           """)
    int updateRealPrice(@Param("id") UUID id, @Param("realPrice") Double realPrice);

    List<PredictionLogEntry> findAllByOrderByTimestampAsc();
}
