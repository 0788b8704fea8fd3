package villagecompute.clipindex.api.rest;

import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.clipindex.api.types.JobAcceptedType;
import villagecompute.clipindex.api.types.ScanRequestType;
import villagecompute.clipindex.exceptions.DuplicateResourceException;
import villagecompute.clipindex.exceptions.PurgeCooldownException;
import villagecompute.clipindex.exceptions.ResourceNotFoundException;
import villagecompute.clipindex.integration.discord.ScanDirection;
import villagecompute.clipindex.services.JobEnqueueService;
import villagecompute.clipindex.services.JobEnqueueService.ScanRequest;
import villagecompute.clipindex.services.RescanMode;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GuildJobResourceTest {

    @Mock
    JobEnqueueService jobEnqueueService;

    @InjectMocks
    GuildJobResource resource;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testRequestScan_acceptedWithJobId() {
        when(jobEnqueueService.requestScan(any())).thenReturn(42L);

        Response response = resource.requestScan("g1", "c1",
                new ScanRequestType("forward", 500, false, "update", null, null));

        assertEquals(202, response.getStatus());
        assertEquals(new JobAcceptedType(42L, "scan"), response.getEntity());
        ArgumentCaptor<ScanRequest> request = ArgumentCaptor.forClass(ScanRequest.class);
        verify(jobEnqueueService).requestScan(request.capture());
        assertEquals(ScanDirection.FORWARD, request.getValue().direction());
        assertEquals(RescanMode.UPDATE, request.getValue().rescan());
        assertEquals(500, request.getValue().limit());
    }

    @Test
    void testRequestScan_emptyBodyUsesDefaults() {
        when(jobEnqueueService.requestScan(ScanRequest.of("g1", "c1"))).thenReturn(7L);

        assertEquals(202, resource.requestScan("g1", "c1", null).getStatus());
    }

    @Test
    void testRequestScan_alreadyRunningIsConflict() {
        when(jobEnqueueService.requestScan(any())).thenThrow(new DuplicateResourceException("Scan already active"));

        assertEquals(409, resource.requestScan("g1", "c1", null).getStatus());
    }

    @Test
    void testRequestScan_badDirectionIsBadRequest() {
        Response response = resource.requestScan("g1", "c1",
                new ScanRequestType("sideways", null, null, null, null, null));

        assertEquals(400, response.getStatus());
        verify(jobEnqueueService, never()).requestScan(any());
    }

    @Test
    void testPurgeChannel_cooldownIsTooManyRequests() {
        when(jobEnqueueService.requestChannelPurge("g1", "c1"))
                .thenThrow(new PurgeCooldownException("c1", Instant.now().plusSeconds(3600)));

        assertEquals(429, resource.purgeChannel("g1", "c1").getStatus());
    }

    @Test
    void testPurgeGuild_unknownGuildIsNotFound() {
        when(jobEnqueueService.requestGuildPurge("g9")).thenThrow(new ResourceNotFoundException("Guild not found"));

        assertEquals(404, resource.purgeGuild("g9").getStatus());
    }
}
