/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import ai.asserts.alertmanager.DispatchConfigProvider;
import ai.asserts.alertmanager.config.DispatchConfig;
import ai.asserts.alertmanager.config.TargetConfig;
import com.google.common.collect.ImmutableList;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.Test;

import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class ConfiguredTargetDiscoveryTest extends EasyMockSupport {
    @Test
    public void discover_reloadsAndSkipsDisabled() {
        DispatchConfigProvider configProvider = mock(DispatchConfigProvider.class);
        TargetConfig ops = TargetConfig.builder().name("ops").url("http://ops/hook").build();
        TargetConfig audit = TargetConfig.builder().name("audit").url("http://audit/hook").enabled(false).build();
        DispatchConfig config = DispatchConfig.builder().targets(ImmutableList.of(ops, audit)).build();

        configProvider.update();
        expect(configProvider.getConfig()).andReturn(config);
        replayAll();

        assertEquals(ImmutableList.of(ops), new ConfiguredTargetDiscovery(configProvider).discover());
        verifyAll();
    }
}
