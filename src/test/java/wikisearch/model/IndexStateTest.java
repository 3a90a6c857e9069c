package wikisearch.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexStateTest {

    @Test
    void rebuildFromPresentEndsPresent() {
        IndexState state = IndexState.of(true).delete().create();

        assertThat(state).isEqualTo(IndexState.PRESENT);
    }

    @Test
    void createFromAbsent() {
        assertThat(IndexState.of(false).create()).isEqualTo(IndexState.PRESENT);
    }

    @Test
    void illegalTransitionsAreRejected() {
        assertThatThrownBy(() -> IndexState.PRESENT.create()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> IndexState.ABSENT.delete()).isInstanceOf(IllegalStateException.class);
    }
}
