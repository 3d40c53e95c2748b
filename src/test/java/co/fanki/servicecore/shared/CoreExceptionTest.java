package co.fanki.servicecore.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link CoreException}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CoreExceptionTest {

    @Test
    void whenCreating_givenNoDetails_shouldHaveEmptyDetails() {
        final CoreException error = new CoreException("m",
                ErrorCode.INTERNAL_ERROR);

        assertEquals("m", error.getMessage());
        assertSame(ErrorCode.INTERNAL_ERROR, error.code());
        assertFalse(error.details().isPresent());
    }

    @Test
    void whenCreating_givenDetails_shouldKeepThem() {
        final CoreException error = new CoreException("m",
                ErrorCode.VALIDATION_ERROR, "x");

        assertEquals("x", error.details().orElseThrow());
    }

    @Test
    void whenCreating_givenNullDetails_shouldHaveEmptyDetails() {
        final CoreException error = new CoreException("m",
                ErrorCode.INTERNAL_ERROR, null);

        assertFalse(error.details().isPresent());
    }

    @Test
    void whenCreating_givenNoCause_shouldNotChainAnything() {
        final CoreException error = new CoreException("m",
                ErrorCode.INTERNAL_ERROR, "x");

        assertNull(error.getCause());
    }

    @Test
    void whenCreating_givenOversizedDetails_shouldTruncateWithMarker() {
        final String longDetails = "a".repeat(
                CoreException.MAX_DETAILS_LENGTH + 100);

        final CoreException error = new CoreException("m",
                ErrorCode.INTERNAL_ERROR, longDetails);

        final String details = error.details().orElseThrow();
        assertEquals(CoreException.MAX_DETAILS_LENGTH
                + CoreException.TRUNCATION_MARKER.length(), details.length());
        assertTrue(details.endsWith(CoreException.TRUNCATION_MARKER));
        assertTrue(details.startsWith("aaaa"));
    }

    @Test
    void whenCreating_givenDetailsAtTheLimit_shouldKeepThemWhole() {
        final String details = "b".repeat(CoreException.MAX_DETAILS_LENGTH);

        final CoreException error = new CoreException("m",
                ErrorCode.INTERNAL_ERROR, details);

        assertEquals(details, error.details().orElseThrow());
    }

    @Test
    void whenCreating_givenNullMessageAndCode_shouldStillSucceed() {
        final CoreException error = new CoreException(null, null);

        assertNull(error.getMessage());
        assertNull(error.code());
        assertEquals("CoreException[null]: null", error.toString());
    }

    @Test
    void whenRendering_givenDetails_shouldIncludeCodeMessageAndDetails() {
        final CoreException error = new CoreException("Boom happened",
                ErrorCode.INTERNAL_ERROR, "stack exhausted");

        assertEquals("CoreException[INTERNAL_ERROR]: Boom happened"
                + " (stack exhausted)", error.toString());
    }

    @Test
    void whenThrowing_givenCoreException_shouldPropagateUnchanged() {
        final CoreException error = new CoreException("m",
                ErrorCode.NOT_FOUND, "x");

        final CoreException caught = assertThrows(CoreException.class,
                () -> {
                    throw error;
                });

        assertSame(error, caught);
        assertSame(ErrorCode.NOT_FOUND, caught.code());
        assertEquals("x", caught.details().orElseThrow());
    }

}
