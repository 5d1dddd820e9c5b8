package com.community.journal.achievement;

import com.community.journal.entity.BadgeType;

import java.util.Map;

/**
 * 徽章规则接口。每个实现类负责一种徽章：根据上下文判断门槛是否达到，并给出发放时记录的元数据。
 * 规则本身不落库，发放（含幂等）由 BadgeService 统一处理。
 */
public interface BadgeRule {

    BadgeType getBadgeType();

    boolean isSatisfied(BadgeContext context);

    /**
     * 发放时写入 user_badge.metadata 的内容
     */
    Map<String, Object> metadata(BadgeContext context);
}
