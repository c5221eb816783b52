package com.example.ticker.service;

import com.example.ticker.domain.TickerStatus;
import com.example.ticker.domain.TimeTicker;
import com.example.ticker.exception.TickerConflictException;
import com.example.ticker.exception.TickerNotFoundException;
import com.example.ticker.support.AbstractTickerIntegrationTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TickerSchedulingServiceTest extends AbstractTickerIntegrationTest {

    @Test
    void createAppliesDefaults() {
        TimeTicker t = scheduling.create(TickerRequest.builder()
                .function(" record ").description("nightly report").executionTime(secondsFromNow(30)).build());

        TimeTicker stored = reload(t.getId());
        assertThat(stored.getFunction()).isEqualTo("record");
        assertThat(stored.getStatus()).isEqualTo(TickerStatus.PENDING);
        assertThat(stored.getRequest()).isEqualTo("{}");
        assertThat(stored.getRetries()).isEqualTo(2);
        assertThat(stored.getRetryCount()).isZero();
        assertThat(stored.getLockHolder()).isNull();
        assertThat(stored.getBatchParentId()).isNull();
        assertThat(stored.getVersion()).isNotNull();
        assertThat(stored.getCreatedAt()).isNotNull();
    }

    @Test
    void createRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> scheduling.create(TickerRequest.builder()
                .executionTime(secondsFromNow(1)).build()));
        assertThrows(IllegalArgumentException.class, () -> scheduling.create(TickerRequest.builder()
                .function("record").build()));
        assertThrows(IllegalArgumentException.class, () -> scheduling.create(TickerRequest.builder()
                .function("record").executionTime(secondsFromNow(1)).request("{not json").build()));
        assertThrows(IllegalArgumentException.class, () -> scheduling.create(TickerRequest.builder()
                .function("record").executionTime(secondsFromNow(1)).retryIntervals("10,soon").build()));
        assertThrows(IllegalArgumentException.class, () -> scheduling.create(TickerRequest.builder()
                .function("record").executionTime(secondsFromNow(1)).retries(-1).build()));
        assertThrows(IllegalArgumentException.class, () -> scheduling.create(TickerRequest.builder()
                .function("r".repeat(TimeTicker.FUNCTION_NAME_LENGTH + 1)).executionTime(secondsFromNow(1)).build()));

        assertThat(tickerRepo.count()).isZero();
    }

    @Test
    void cancelPendingTicker() {
        TimeTicker t = create("record", secondsFromNow(30));

        scheduling.cancel(t.getId());

        assertThat(scheduling.status(t.getId())).isEqualTo(TickerStatus.CANCELLED);
        assertThat(tx.findCandidatesTx(secondsFromNow(60), 10)).isEmpty();
    }

    @Test
    void cancelDoesNotPreemptClaimedTicker() {
        TimeTicker t = create("record", secondsFromNow(-1));
        tx.claimTx(reload(t.getId()), "worker-1");

        assertThrows(TickerConflictException.class, () -> scheduling.cancel(t.getId()));

        tx.markRunningTx(t.getId(), "worker-1");
        assertThat(tx.completeTx(t.getId(), "worker-1", true, null, 1L)).isEqualTo(TickerStatus.SUCCEEDED);
        assertThat(scheduling.status(t.getId())).isEqualTo(TickerStatus.SUCCEEDED);
    }

    @Test
    void deleteOfRunningTickerIsRefused() {
        TimeTicker t = create("record", secondsFromNow(-1));
        tx.claimTx(reload(t.getId()), "worker-1");
        tx.markRunningTx(t.getId(), "worker-1");

        assertThrows(TickerConflictException.class, () -> scheduling.delete(t.getId()));
        assertThat(scheduling.status(t.getId())).isEqualTo(TickerStatus.RUNNING);
    }

    @Test
    void unknownIdIsReportedAsNotFound() {
        assertThrows(TickerNotFoundException.class, () -> scheduling.status(Long.MAX_VALUE));
        assertThrows(TickerNotFoundException.class, () -> scheduling.cancel(Long.MAX_VALUE));
        assertThrows(TickerNotFoundException.class, () -> scheduling.delete(Long.MAX_VALUE));
    }

    @Test
    void childrenListsBatchMembersInIdOrder() {
        TimeTicker parent = create("record", secondsFromNow(3600));
        TimeTicker c1 = createChild("record", secondsFromNow(10), parent.getId());
        TimeTicker c2 = createChild("record", secondsFromNow(5), parent.getId());

        assertThat(scheduling.children(parent.getId()))
                .extracting(TimeTicker::getId)
                .containsExactly(c1.getId(), c2.getId());
    }
}
