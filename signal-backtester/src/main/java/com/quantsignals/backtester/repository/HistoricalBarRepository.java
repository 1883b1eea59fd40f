package com.quantsignals.backtester.repository;

import com.quantsignals.backtester.domain.HistoricalBar;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for stored daily bars.
 */
@Repository
public interface HistoricalBarRepository extends JpaRepository<HistoricalBar, Long> {

    /**
     * Find bars for a symbol within an inclusive date range, oldest first.
     */
    @Query("SELECT h FROM HistoricalBar h WHERE h.symbol = :symbol " +
            "AND h.date >= :startDate AND h.date <= :endDate ORDER BY h.date ASC")
    List<HistoricalBar> findBySymbolAndDateRange(
            @Param("symbol") String symbol,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);
}
