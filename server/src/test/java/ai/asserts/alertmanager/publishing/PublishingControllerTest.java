/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import ai.asserts.alertmanager.error.RefreshInProgressException;
import com.google.common.collect.ImmutableList;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PublishingControllerTest extends EasyMockSupport {
    private RefreshManager refreshManager;
    private PublishingTargetRegistry targetRegistry;
    private PublishingController controller;

    @BeforeEach
    public void setup() {
        refreshManager = mock(RefreshManager.class);
        targetRegistry = new PublishingTargetRegistry();
        controller = new PublishingController(refreshManager, targetRegistry);
    }

    @Test
    public void refresh() {
        refreshManager.refreshNow();
        replayAll();

        ResponseEntity<Map<String, String>> response = controller.refresh();
        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        assertEquals("accepted", response.getBody().get("status"));
        verifyAll();
    }

    @Test
    public void refresh_inProgress() {
        refreshManager.refreshNow();
        expectLastCall().andThrow(new RefreshInProgressException());
        replayAll();

        assertThrows(RefreshInProgressException.class, () -> controller.refresh());
        verifyAll();
    }

    @Test
    public void status() {
        RefreshStatus status = RefreshStatus.builder().state(RefreshState.SUCCESS).targetsValid(2).build();
        expect(refreshManager.getStatus()).andReturn(status);
        replayAll();

        assertSame(status, controller.status().getBody());
        verifyAll();
    }

    @Test
    public void targets() {
        PublishingTarget ops = PublishingTarget.builder().name("ops").url("http://ops/hook").valid(true).build();
        targetRegistry.replace(ImmutableList.of(ops));
        replayAll();

        assertEquals(ImmutableList.of(ops), controller.targets().getBody());
        verifyAll();
    }
}
