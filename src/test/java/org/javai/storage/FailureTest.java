package org.javai.storage;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FailureTest {

    private static final FailureId ID = FailureId.of("storage", "backendError");

    @Test
    void tags_keepInsertionOrder() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("status", "500");
        tags.put("kind", "INTERNAL_SERVER_ERROR");
        tags.put("bucket", "photos");
        tags.put("attempt", "3");
        tags.put("region", "us-east1");

        Failure failure = Failure.transientFailure(ID, "backend error", "objects.get", null).withTags(tags);

        assertThat(failure.tags().keySet()).containsExactly("status", "kind", "bucket", "attempt", "region");
    }

    @Test
    void tags_areACopyAndUnmodifiable() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("status", "500");

        Failure failure = Failure.transientFailure(ID, "backend error", "objects.get", null).withTags(tags);
        tags.put("kind", "INTERNAL_SERVER_ERROR");

        assertThat(failure.tags()).containsOnlyKeys("status");
        assertThatThrownBy(() -> failure.tags().put("kind", "OTHER"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void tags_defaultToEmpty() {
        assertThat(Failure.permanentFailure(ID, "gone", "objects.get", null).tags()).isEmpty();
    }
}
