package com.yoursp.faceapproval.repository;

import com.yoursp.faceapproval.model.entity.ConsoleLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConsoleLogRepository extends JpaRepository<ConsoleLog, Long> {

    List<ConsoleLog> findAllByOrderByTimestampDescIdDesc(Pageable pageable);

    List<ConsoleLog> findAllByOrderByTimestampAscIdAsc(Pageable pageable);
}
