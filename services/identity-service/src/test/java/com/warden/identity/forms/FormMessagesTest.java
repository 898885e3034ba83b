package com.warden.identity.forms;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.forms.FormDescriptor;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.support.PropertiesLoaderUtils;

/**
 * Keeps the field labels in {@code messages.properties} in step with the form descriptors.
 */
@DisplayName("Form messages")
class FormMessagesTest {

    private static final List<FormDescriptor<?>> DESCRIPTORS =
            List.of(SignInForm.DESCRIPTOR, SignUpForm.DESCRIPTOR, NewAccessTokenForm.DESCRIPTOR);

    private static Properties messages;

    @BeforeAll
    static void loadMessages() throws Exception {
        messages = PropertiesLoaderUtils.loadAllProperties("messages.properties");
    }

    private static Set<String> labelledFieldNames() {
        return DESCRIPTORS.stream()
                .flatMap(d -> d.fields().stream().filter(f -> !f.isIgnored()).map(f -> f.name()))
                .collect(Collectors.toSet());
    }

    @Test
    @DisplayName("every validated field has a label")
    void everyFieldHasLabel() {
        assertThat(labelledFieldNames())
                .allSatisfy(name -> assertThat(messages).containsKey("form." + name));
    }

    @Test
    @DisplayName("every label belongs to a validated field")
    void noStaleLabels() {
        Set<String> labels =
                messages.stringPropertyNames().stream()
                        .filter(key -> key.startsWith("form."))
                        .map(key -> key.substring("form.".length()))
                        .filter(rest -> Character.isUpperCase(rest.charAt(0)))
                        .collect(Collectors.toSet());

        assertThat(labels).containsExactlyInAnyOrderElementsOf(labelledFieldNames());
    }
}
