package com.yoursp.faceapproval.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

@Entity
@Table(name = "console_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsoleLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "timestamp", nullable = false)
    private OffsetDateTime timestamp;

    @Column(name = "action", columnDefinition = "TEXT")
    private String action;

    /** Pre-rendered "[yyyy-MM-dd HH:mm:ss] action" line shown in the admin console. */
    @Column(name = "formatted", columnDefinition = "TEXT")
    private String formatted;
}
