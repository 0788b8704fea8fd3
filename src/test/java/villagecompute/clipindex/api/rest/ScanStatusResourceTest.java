package villagecompute.clipindex.api.rest;

import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.clipindex.api.types.GuildScanStatusesType;
import villagecompute.clipindex.api.types.ScanStatusType;
import villagecompute.clipindex.services.ScanState;
import villagecompute.clipindex.services.ScanStateService;
import villagecompute.clipindex.services.ScanStateService.ScanStatusView;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

class ScanStatusResourceTest {

    @Mock
    ScanStateService scanStateService;

    @InjectMocks
    ScanStatusResource resource;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    private static ScanStatusView view(String channelId, ScanState state) {
        return new ScanStatusView(channelId, state, 3, 250, Instant.parse("2024-01-01T00:00:00Z"), null);
    }

    @Test
    void testListStatuses_shortPollWhileScanRunning() {
        when(scanStateService.getGuildStatuses("g1"))
                .thenReturn(List.of(view("c1", ScanState.SUCCEEDED), view("c2", ScanState.RUNNING)));

        GuildScanStatusesType body = resource.listStatuses("g1");

        assertTrue(body.active());
        assertEquals(ScanStatusResource.ACTIVE_POLL_SECONDS, body.pollAfterSeconds());
        assertEquals(2, body.statuses().size());
        assertEquals("RUNNING", body.statuses().get(1).status());
    }

    @Test
    void testListStatuses_longPollWhenIdle() {
        when(scanStateService.getGuildStatuses("g1")).thenReturn(List.of(view("c1", ScanState.FAILED)));

        GuildScanStatusesType body = resource.listStatuses("g1");

        assertFalse(body.active());
        assertEquals(ScanStatusResource.IDLE_POLL_SECONDS, body.pollAfterSeconds());
    }

    @Test
    void testGetStatus_found() {
        when(scanStateService.getStatus("c1")).thenReturn(Optional.of(view("c1", ScanState.PENDING)));

        Response response = resource.getStatus("g1", "c1");

        assertEquals(200, response.getStatus());
        ScanStatusType body = (ScanStatusType) response.getEntity();
        assertEquals(250, body.totalMessagesScanned());
    }

    @Test
    void testGetStatus_unknownChannel() {
        when(scanStateService.getStatus("c9")).thenReturn(Optional.empty());

        assertEquals(404, resource.getStatus("g1", "c9").getStatus());
    }
}
