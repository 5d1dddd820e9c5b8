package com.community.journal.repository;

import com.community.journal.entity.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    // 批量取昵称（日报 / 排行榜）
    List<AppUser> findByUserIdIn(Collection<Long> userIds);
}
