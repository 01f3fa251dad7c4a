package com.ridedispatch.dispatch.repository;

import com.ridedispatch.dispatch.entity.DeclineRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DeclineRecordRepository extends JpaRepository<DeclineRecord, Long> {

    boolean existsByOrderIdAndDriverId(UUID orderId, String driverId);

    long countByOrderId(UUID orderId);

    @Query("SELECT d.driverId FROM DeclineRecord d WHERE d.orderId = :orderId")
    List<String> findDriverIdsByOrderId(@Param("orderId") UUID orderId);
}
