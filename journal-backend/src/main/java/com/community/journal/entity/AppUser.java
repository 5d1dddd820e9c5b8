package com.community.journal.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * AppUser Entity: 用户基础信息表
 * 核心模块只读取此表（存在性校验、昵称展示），注册与登录由外部服务负责。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "app_user")
public class AppUser {

    /**
     * user_id: 用户唯一标识符 (Primary Key)
     */
    @Id
    @Column(name = "user_id")
    private Long userId;

    /**
     * username: 昵称，猜作者游戏中公开展示的名字
     */
    @Column(name = "username", nullable = false, unique = true, length = 100)
    private String username;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
