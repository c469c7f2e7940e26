package com.urlshortener.infrastructure.id;

import com.urlshortener.application.port.out.SaltGenerator;
import com.urlshortener.domain.encoding.ShortCodeEncoder;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

@Component
public class RandomSaltGenerator implements SaltGenerator {

    @Override
    public int nextSalt() {
        return ThreadLocalRandom.current().nextInt(ShortCodeEncoder.SALT_MULTIPLIER);
    }
}
