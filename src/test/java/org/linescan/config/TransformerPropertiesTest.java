package org.linescan.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.LoaderOptions;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TransformerProperties
 */
@DisplayName("TransformerProperties Tests")
class TransformerPropertiesTest {

    private TransformerProperties properties;
    private Validator validator;

    @BeforeEach
    void setUp() {
        properties = new TransformerProperties();
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Should have valid default values")
        void shouldHaveValidDefaults() {
            assertEquals(List.of("yaml", "yml"), properties.getExtensions());
            assertEquals("ISO-8859-1", properties.getFallbackEncoding());
            assertTrue(properties.isAllowDuplicateKeys());
            assertEquals(50, properties.getMaxAliasesForCollections());
            assertEquals(50, properties.getNestingDepthLimit());
            assertEquals(3145728, properties.getCodePointLimit());
            assertTrue(validator.validate(properties).isEmpty());
        }

        @Test
        @DisplayName("Should resolve the fallback charset")
        void shouldResolveFallbackCharset() {
            assertEquals(StandardCharsets.ISO_8859_1, properties.fallbackCharset());
        }
    }

    @Nested
    @DisplayName("Loader options")
    class LoaderOptionsTests {

        @Test
        @DisplayName("Should copy every limit into fresh loader options")
        void shouldBuildLoaderOptions() {
            // Given
            properties.setAllowDuplicateKeys(false);
            properties.setMaxAliasesForCollections(5);
            properties.setNestingDepthLimit(7);
            properties.setCodePointLimit(1024);

            // When
            LoaderOptions options = properties.toLoaderOptions();

            // Then
            assertFalse(options.isAllowDuplicateKeys());
            assertEquals(5, options.getMaxAliasesForCollections());
            assertEquals(7, options.getNestingDepthLimit());
            assertEquals(1024, options.getCodePointLimit());
            assertTrue(options.isWrappedToRootException());
            assertNotSame(options, properties.toLoaderOptions());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should reject empty extensions")
        void shouldRejectEmptyExtensions() {
            properties.setExtensions(List.of());

            Set<ConstraintViolation<TransformerProperties>> violations = validator.validate(properties);

            assertEquals(1, violations.size());
            assertEquals("extensions", violations.iterator().next().getPropertyPath().toString());
        }

        @Test
        @DisplayName("Should reject blank fallback encoding")
        void shouldRejectBlankEncoding() {
            properties.setFallbackEncoding(" ");

            assertFalse(validator.validate(properties).isEmpty());
        }

        @Test
        @DisplayName("Should reject non-positive limits")
        void shouldRejectNonPositiveLimits() {
            properties.setMaxAliasesForCollections(0);
            properties.setNestingDepthLimit(-1);
            properties.setCodePointLimit(0);

            assertEquals(3, validator.validate(properties).size());
        }
    }
}
