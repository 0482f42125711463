package me.golemcore.codeshell;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class CodeShellApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(CodeShellApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(CodeShellApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(CodeShellApplication.class.getMethod("main", String[].class));
    }
}
