package com.yoursp.faceapproval.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.faceapproval.repository.AccessSessionRepository;
import com.yoursp.faceapproval.repository.ConsoleLogRepository;
import com.yoursp.faceapproval.repository.IdentityRepository;
import com.yoursp.faceapproval.service.storage.ApprovalStore;
import com.yoursp.faceapproval.service.storage.DatabaseApprovalStore;
import com.yoursp.faceapproval.service.storage.InMemoryApprovalStore;
import com.yoursp.faceapproval.service.storage.StorageProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;

/**
 * Selects the storage backend once, at start-up.
 * <p>
 * PostgreSQL and Redis must both answer the probe for the database backend to
 * be used; otherwise the process runs on {@link InMemoryApprovalStore} until
 * restart.
 * </p>
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    public ApprovalStore approvalStore(StorageProbe probe,
            DataSource dataSource,
            IdentityRepository identityRepository,
            AccessSessionRepository sessionRepository,
            ConsoleLogRepository consoleLogRepository,
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            PlatformTransactionManager transactionManager,
            FaceApprovalProperties properties,
            Clock clock) {

        Duration ticketTtl = properties.getCapture().getTicketTtl();

        if (probe.databaseReachable() && probe.redisReachable()) {
            try {
                new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
                log.info("Storage: database backend selected (PostgreSQL + Redis)");
                return new DatabaseApprovalStore(identityRepository, sessionRepository,
                        consoleLogRepository, redisTemplate, objectMapper,
                        new TransactionTemplate(transactionManager), ticketTtl, clock);
            } catch (DataAccessException e) {
                log.error("Schema initialization failed, falling back to in-memory storage: {}", e.getMessage());
            }
        }

        log.warn("Storage: in-memory fallback selected");
        return new InMemoryApprovalStore(clock, ticketTtl);
    }
}
