package com.jreinhal.docguard;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.docguard.security.SecretScanner;
import com.jreinhal.docguard.service.DocumentSecurityPipeline;
import com.jreinhal.docguard.service.PreDistributionValidator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class DocGuardApplicationTests {

    @Autowired
    private DocumentSecurityPipeline pipeline;

    @Autowired
    private SecretScanner secretScanner;

    @Autowired
    private PreDistributionValidator preDistributionValidator;

    @Test
    void contextLoads() {
        assertThat(pipeline).isNotNull();
        assertThat(secretScanner.statistics().totalPatterns()).isEqualTo(54);
        assertThat(preDistributionValidator.statistics().blockingRules()).isEqualTo(6);
    }
}
