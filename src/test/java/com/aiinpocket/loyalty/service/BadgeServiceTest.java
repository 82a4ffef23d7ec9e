package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.config.LoyaltyProperties;
import com.aiinpocket.loyalty.exception.NotFoundException;
import com.aiinpocket.loyalty.model.criteria.RewardCriteria;
import com.aiinpocket.loyalty.model.dto.BadgeGrantResult;
import com.aiinpocket.loyalty.model.dto.PointsAwardResult;
import com.aiinpocket.loyalty.model.entity.Badge;
import com.aiinpocket.loyalty.model.entity.Challenge;
import com.aiinpocket.loyalty.model.entity.UserBadge;
import com.aiinpocket.loyalty.model.enums.ChallengeType;
import com.aiinpocket.loyalty.model.enums.PointsType;
import com.aiinpocket.loyalty.repository.BadgeRepository;
import com.aiinpocket.loyalty.repository.ChallengeRepository;
import com.aiinpocket.loyalty.repository.PlatformUserRepository;
import com.aiinpocket.loyalty.repository.UserBadgeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BadgeService 授予徽章")
class BadgeServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-04T15:00:00Z");

    @Mock
    private PlatformUserRepository userRepo;

    @Mock
    private BadgeRepository badgeRepo;

    @Mock
    private UserBadgeRepository userBadgeRepo;

    @Mock
    private ChallengeRepository challengeRepo;

    @Mock
    private PointsLedgerService ledger;

    private BadgeService badgeService;

    @BeforeEach
    void setUp() {
        LoyaltyProperties properties = new LoyaltyProperties("key", null, "America/Sao_Paulo", 3,
                new LoyaltyProperties.PageLimits(50, 100), new LoyaltyProperties.PageLimits(50, 100), List.of());
        badgeService = new BadgeService(userRepo, badgeRepo, userBadgeRepo, challengeRepo, ledger, properties,
                Clock.fixed(NOW, ZoneId.of("America/Sao_Paulo")));
    }

    @Test
    @DisplayName("首次授予時發放積分並回傳解鎖內容")
    @SuppressWarnings("unchecked")
    void grantAwardsPointsOnce() {
        when(userRepo.existsById(1L)).thenReturn(true);
        when(badgeRepo.findById(7L)).thenReturn(Optional.of(badge(true)));
        when(userBadgeRepo.insertIfAbsent(1L, 7L, NOW)).thenReturn(1);
        when(ledger.appendPoints(1L, 100, PointsType.BADGE, "獲得徽章: 百單達人", null))
                .thenReturn(new PointsAwardResult(1L, 100, PointsType.BADGE, "獲得徽章: 百單達人",
                        320L, 2, 3, "銀牌", 0L, true));
        Challenge open = Challenge.builder().id(3L).title("週末加碼").challengeType(ChallengeType.WEEKLY)
                .criteria(new RewardCriteria.Orders(2)).pointsReward(30).startDate(NOW).active(true).build();
        when(challengeRepo.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(open)));

        BadgeGrantResult result = badgeService.grantBadge(1L, 7L, null);

        assertThat(result.newlyGranted()).isTrue();
        assertThat(result.pointsAwarded()).isEqualTo(100);
        assertThat(result.newTotalPoints()).isEqualTo(320L);
        assertThat(result.unlockedContent().levelUp()).isTrue();
        assertThat(result.unlockedContent().newChallenges()).singleElement()
                .satisfies(c -> assertThat(c.title()).isEqualTo("週末加碼"));
        assertThat(result.unlockedContent().specialRewards()).singleElement()
                .satisfies(r -> assertThat(r.type()).isEqualTo("discount"));
    }

    @Test
    @DisplayName("重複授予為無操作，不再發放積分")
    void duplicateGrantIsNoOp() {
        Instant firstEarned = NOW.minusSeconds(3600);
        when(userRepo.existsById(1L)).thenReturn(true);
        when(badgeRepo.findById(7L)).thenReturn(Optional.of(badge(true)));
        when(userBadgeRepo.insertIfAbsent(1L, 7L, NOW)).thenReturn(0);
        when(userBadgeRepo.findByUserIdAndBadgeId(1L, 7L)).thenReturn(Optional.of(
                UserBadge.builder().id(1L).userId(1L).badgeId(7L).earnedAt(firstEarned).build()));

        BadgeGrantResult result = badgeService.grantBadge(1L, 7L, "重送");

        assertThat(result.newlyGranted()).isFalse();
        assertThat(result.pointsAwarded()).isZero();
        assertThat(result.earnedAt()).isEqualTo(firstEarned);
        verify(ledger, never()).appendPoints(anyLong(), anyInt(), any(), anyString(), any());
    }

    @Test
    @DisplayName("已停用的徽章視為不存在")
    void inactiveBadgeNotFound() {
        when(userRepo.existsById(1L)).thenReturn(true);
        when(badgeRepo.findById(7L)).thenReturn(Optional.of(badge(false)));

        assertThatThrownBy(() -> badgeService.grantBadge(1L, 7L, null))
                .isInstanceOf(NotFoundException.class);
        verify(userBadgeRepo, never()).insertIfAbsent(anyLong(), anyLong(), any());
    }

    private static Badge badge(boolean active) {
        return Badge.builder()
                .id(7L)
                .name("百單達人")
                .criteria(new RewardCriteria.Orders(100))
                .pointsReward(100)
                .active(active)
                .build();
    }
}
