package com.example.rls;

import com.example.rls.engine.RlsPolicyEngine;
import com.example.rls.store.PolicyStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class RlsEngineApplicationTests {

    @Autowired
    private RlsPolicyEngine policyEngine;

    @Autowired
    private PolicyStore policyStore;

    @Test
    void contextLoads() {
        assertThat(policyEngine).isNotNull();
        assertThat(policyStore).isNotNull();
    }
}
