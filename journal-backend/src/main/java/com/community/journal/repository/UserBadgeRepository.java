package com.community.journal.repository;

import com.community.journal.entity.UserBadge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserBadgeRepository extends JpaRepository<UserBadge, Long>, UserBadgeRepositoryCustom {

    List<UserBadge> findByUserIdOrderByEarnedAtDesc(Long userId);
}
