package com.z2api;

import com.z2api.pool.service.ChatRelayService;
import com.z2api.pool.service.CredentialPoolManager;
import com.z2api.pool.service.CredentialRecoveryScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "z2api.cookies=tokA,u@e.com----pw----tokB",
        "z2api.pool.store-type=none",
        "z2api.pool.recovery-enabled=false"
})
class Z2ApiApplicationTests {

    @Autowired
    ApplicationContext context;

    @Autowired
    CredentialPoolManager poolManager;

    @Test
    void contextLoadsWithConfiguredCredentials() {
        assertThat(context.getBean(ChatRelayService.class)).isNotNull();
        assertThat(context.getBeansOfType(CredentialRecoveryScheduler.class)).isEmpty();
        assertThat(poolManager.listState().getEntries()).containsExactly("tokA", "u@e.com----pw----tokB");
    }
}
