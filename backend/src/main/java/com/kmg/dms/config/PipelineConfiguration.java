package com.kmg.dms.config;

import org.apache.tika.Tika;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.time.Clock;
import java.util.Base64;

@Configuration
public class PipelineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Tika tika() {
        return new Tika();
    }

    @Bean
    public SecretKey contentEncryptionKey(DmsProperties properties) {
        byte[] raw = Base64.getDecoder().decode(properties.getEncryption().getKey().trim());
        if (raw.length != 32) {
            throw new IllegalStateException("dms.encryption.key must decode to 32 bytes, got " + raw.length);
        }
        return new SecretKeySpec(raw, "AES");
    }
}
