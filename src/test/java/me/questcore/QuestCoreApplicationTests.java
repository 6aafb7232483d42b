package me.questcore;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class QuestCoreApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(QuestCoreApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(QuestCoreApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(QuestCoreApplication.class.getMethod("main", String[].class));
    }
}
