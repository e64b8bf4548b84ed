package com.relayauthority;

import com.relayauthority.relay.RelayClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@ActiveProfiles("test")
class RelayAuthorityApplicationTests {

    @MockitoBean
    private RelayClient relayClient;

    @Test
    void contextLoads() {
    }
}
