package com.pgbranch.capture.capture;

import com.pgbranch.capture.CaptureNames;
import com.pgbranch.capture.exception.CaptureException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * The in-engine half of capture and audit: trigger functions, the table renderer and the event triggers.
 * Loaded once from the classpath.
 */
@Component
public class CaptureScript {

    private volatile String text;

    public String text() {
        String loaded = text;
        if (loaded == null) {
            loaded = load();
            text = loaded;
        }
        return loaded;
    }

    private static String load() {
        ClassPathResource resource = new ClassPathResource(CaptureNames.INSTALL_SCRIPT);
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CaptureException("Cannot read install script: " + CaptureNames.INSTALL_SCRIPT, e);
        }
    }
}
