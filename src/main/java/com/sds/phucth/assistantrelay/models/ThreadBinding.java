package com.sds.phucth.assistantrelay.models;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

@Entity
@Table(name="threads")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ThreadBinding {
    @Id
    @Column(name="session_id")
    private String sessionId;

    @Column(name="thread_id", nullable = false)
    private String threadId;

    @Column(name="created_at")
    private OffsetDateTime createdAt;

    @Column(name="updated_at")
    private OffsetDateTime updatedAt;
}
