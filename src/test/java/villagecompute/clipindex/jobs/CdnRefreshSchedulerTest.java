package villagecompute.clipindex.jobs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.clipindex.services.CdnRefreshService;
import villagecompute.clipindex.services.JobEnqueueService;
import villagecompute.clipindex.services.JobQueueService;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CdnRefreshScheduler}.
 */
class CdnRefreshSchedulerTest {

    @Mock
    CdnRefreshService cdnRefreshService;

    @Mock
    JobEnqueueService jobEnqueueService;

    @Mock
    JobQueueService jobQueueService;

    @InjectMocks
    CdnRefreshScheduler scheduler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        scheduler.refreshWindow = Duration.ofHours(1);
        scheduler.maxPerRun = 500;
        when(jobEnqueueService.requestCdnRefresh(anyString(), anyList())).thenReturn(List.of(1L));
    }

    @Test
    void testScheduleRefresh_skipsClipsWithQueuedRefresh() {
        when(cdnRefreshService.findExpiring(Duration.ofHours(1), 500))
                .thenReturn(Map.of("g1", List.of("clip-a", "clip-b", "clip-c")));
        when(jobQueueService.pendingClipIds(JobType.CDN_REFRESH, "g1")).thenReturn(Set.of("clip-a", "clip-c"));

        scheduler.scheduleRefresh();

        verify(jobEnqueueService).requestCdnRefresh("g1", List.of("clip-b"));
    }

    @Test
    void testScheduleRefresh_secondTickEnqueuesNothingWhileJobsPending() {
        when(cdnRefreshService.findExpiring(Duration.ofHours(1), 500))
                .thenReturn(Map.of("g1", List.of("clip-a", "clip-b")));
        when(jobQueueService.pendingClipIds(JobType.CDN_REFRESH, "g1")).thenReturn(Set.of("clip-a", "clip-b"));

        scheduler.scheduleRefresh();

        verify(jobEnqueueService, never()).requestCdnRefresh(anyString(), anyList());
    }

    @Test
    void testScheduleRefresh_enqueuesEveryGuild() {
        when(cdnRefreshService.findExpiring(Duration.ofHours(1), 500))
                .thenReturn(Map.of("g1", List.of("clip-a"), "g2", List.of("clip-z")));
        when(jobQueueService.pendingClipIds(JobType.CDN_REFRESH, "g1")).thenReturn(Set.of());
        when(jobQueueService.pendingClipIds(JobType.CDN_REFRESH, "g2")).thenReturn(Set.of());

        scheduler.scheduleRefresh();

        verify(jobEnqueueService).requestCdnRefresh("g1", List.of("clip-a"));
        verify(jobEnqueueService).requestCdnRefresh("g2", List.of("clip-z"));
    }
}
