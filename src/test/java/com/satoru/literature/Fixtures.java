package com.satoru.literature;

import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

public final class Fixtures {

    private Fixtures() {
    }

    public static byte[] load(String name) {
        try (InputStream in = new ClassPathResource("fixtures/" + name).getInputStream()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Missing test fixture " + name, e);
        }
    }
}
