package com.aiinpocket.loyalty.service;

import com.aiinpocket.loyalty.config.LoyaltyProperties;
import com.aiinpocket.loyalty.exception.NotFoundException;
import com.aiinpocket.loyalty.exception.ValidationException;
import com.aiinpocket.loyalty.model.criteria.LevelBenefits;
import com.aiinpocket.loyalty.model.dto.PointsAwardResult;
import com.aiinpocket.loyalty.model.dto.PointsSummary;
import com.aiinpocket.loyalty.model.entity.PointsHistory;
import com.aiinpocket.loyalty.model.enums.PointsType;
import com.aiinpocket.loyalty.repository.PlatformUserRepository;
import com.aiinpocket.loyalty.repository.PointsHistoryRepository;
import com.aiinpocket.loyalty.repository.UserPointsRepository;
import com.aiinpocket.loyalty.service.LevelTable.LevelDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

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
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PointsLedgerService 積分入帳")
class PointsLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-04T15:00:00Z");
    private static final LevelTable TABLE = LevelTable.of(List.of(
            new LevelDefinition(1, "新手", 0, LevelBenefits.NONE),
            new LevelDefinition(2, "銅牌", 100, LevelBenefits.NONE),
            new LevelDefinition(3, "銀牌", 300, LevelBenefits.NONE)));

    @Mock
    private PlatformUserRepository userRepo;

    @Mock
    private UserPointsRepository userPointsRepo;

    @Mock
    private PointsHistoryRepository historyRepo;

    @Mock
    private LevelCatalog levelCatalog;

    @Captor
    private ArgumentCaptor<PointsHistory> historyCaptor;

    private PointsLedgerService ledger;

    @BeforeEach
    void setUp() {
        LoyaltyProperties properties = new LoyaltyProperties("key", null, "America/Sao_Paulo", 3,
                new LoyaltyProperties.PageLimits(50, 100), new LoyaltyProperties.PageLimits(50, 100), List.of());
        ledger = new PointsLedgerService(userRepo, userPointsRepo, historyRepo, levelCatalog, properties,
                Clock.fixed(NOW, ZoneId.of("America/Sao_Paulo")));
    }

    @Test
    @DisplayName("入帳後寫入帳本、原子累加並依重新讀取的總分升級")
    void appendPointsLevelsUp() {
        when(levelCatalog.currentTable()).thenReturn(TABLE);
        when(userPointsRepo.existsById(1L)).thenReturn(true);
        when(userPointsRepo.incrementTotal(1L, 200L, NOW)).thenReturn(1);
        when(userPointsRepo.findTotalPoints(1L)).thenReturn(Optional.of(250L));
        when(userPointsRepo.updateLevelIfChanged(1L, 2, NOW)).thenReturn(1);

        PointsAwardResult result = ledger.appendPoints(1L, 200, PointsType.ORDER, "訂單 #991", 991L);

        verify(historyRepo).save(historyCaptor.capture());
        PointsHistory saved = historyCaptor.getValue();
        assertThat(saved.getPointsEarned()).isEqualTo(200);
        assertThat(saved.getPointsType()).isEqualTo(PointsType.ORDER);
        assertThat(saved.getOrderId()).isEqualTo(991L);
        assertThat(saved.getCreatedAt()).isEqualTo(NOW);

        assertThat(result.newTotal()).isEqualTo(250L);
        assertThat(result.previousLevel()).isEqualTo(1);
        assertThat(result.currentLevel()).isEqualTo(2);
        assertThat(result.leveledUp()).isTrue();
        assertThat(result.pointsToNextLevel()).isEqualTo(50L);
        verify(userPointsRepo, never()).insertIfAbsent(anyLong(), anyInt(), any());
    }

    @Test
    @DisplayName("第一次入帳時建立積分帳戶")
    void firstAppendCreatesAccount() {
        when(levelCatalog.currentTable()).thenReturn(TABLE);
        when(userPointsRepo.existsById(5L)).thenReturn(false);
        when(userRepo.existsById(5L)).thenReturn(true);
        when(userPointsRepo.insertIfAbsent(5L, 1, NOW)).thenReturn(1);
        when(userPointsRepo.incrementTotal(5L, 10L, NOW)).thenReturn(1);
        when(userPointsRepo.findTotalPoints(5L)).thenReturn(Optional.of(10L));
        when(userPointsRepo.updateLevelIfChanged(5L, 1, NOW)).thenReturn(0);

        PointsAwardResult result = ledger.appendPoints(5L, 10, PointsType.REVIEW, null, null);

        assertThat(result.newTotal()).isEqualTo(10L);
        assertThat(result.leveledUp()).isFalse();
        assertThat(result.description()).contains("評價");
    }

    @Test
    @DisplayName("非正數積分在任何寫入前拒絕")
    void rejectsNonPositiveDelta() {
        assertThatThrownBy(() -> ledger.appendPoints(1L, 0, PointsType.ORDER, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.appendPoints(1L, -5, PointsType.ORDER, null, null))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(historyRepo, userPointsRepo);
    }

    @Test
    @DisplayName("不存在的使用者回應 NotFound 且不寫入帳本")
    void unknownUser() {
        when(levelCatalog.currentTable()).thenReturn(TABLE);
        when(userPointsRepo.existsById(404L)).thenReturn(false);
        when(userRepo.existsById(404L)).thenReturn(false);

        assertThatThrownBy(() -> ledger.appendPoints(404L, 10, PointsType.ORDER, null, null))
                .isInstanceOf(NotFoundException.class);
        verifyNoInteractions(historyRepo);
    }

    @Test
    @DisplayName("彙總列未被更新時中止交易")
    void incrementMustTouchOneRow() {
        when(levelCatalog.currentTable()).thenReturn(TABLE);
        when(userPointsRepo.existsById(1L)).thenReturn(true);
        when(userPointsRepo.incrementTotal(1L, 10L, NOW)).thenReturn(0);

        assertThatThrownBy(() -> ledger.appendPoints(1L, 10, PointsType.BONUS, null, null))
                .isInstanceOf(IllegalStateException.class);
        verify(userPointsRepo, never()).updateLevelIfChanged(anyLong(), anyInt(), any());
    }

    @Test
    @DisplayName("沒有積分紀錄的使用者讀取為 0 分第一級，不建立資料")
    void getPointsWithoutAccount() {
        when(userRepo.existsById(3L)).thenReturn(true);
        when(levelCatalog.currentTable()).thenReturn(TABLE);
        when(userPointsRepo.findById(3L)).thenReturn(Optional.empty());

        PointsSummary summary = ledger.getPoints(3L);

        assertThat(summary.totalPoints()).isZero();
        assertThat(summary.currentLevel().number()).isEqualTo(1);
        assertThat(summary.nextLevel().number()).isEqualTo(2);
        assertThat(summary.pointsToNextLevel()).isEqualTo(100L);
        verify(userPointsRepo, never()).insertIfAbsent(anyLong(), anyInt(), any());
    }

    @Test
    @DisplayName("分頁上限超過 100 時拒絕")
    void historyLimitCapped() {
        when(userRepo.existsById(1L)).thenReturn(true);

        assertThatThrownBy(() -> ledger.getPointsHistory(1L, null, 101, 0L))
                .isInstanceOf(ValidationException.class);
    }
}
