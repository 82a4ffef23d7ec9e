package com.aiinpocket.loyalty.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 外送平台的使用者（users 表）。
 * 此表由平台帳號系統維護，忠誠計畫只用來確認使用者存在與顯示名稱。
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlatformUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 100)
    private String name;

    @Column(length = 100)
    private String email;

    @Column(length = 30)
    private String phone;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
