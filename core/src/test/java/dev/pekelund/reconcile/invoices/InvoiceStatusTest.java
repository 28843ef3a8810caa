package dev.pekelund.reconcile.invoices;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.reconcile.errors.ValidationException;
import org.junit.jupiter.api.Test;

class InvoiceStatusTest {

    @Test
    void errorIsReachableFromProcessingStepsAndRetriesToPending() {
        assertThat(InvoiceStatus.EXTRACTING.canTransitionTo(InvoiceStatus.ERROR)).isTrue();
        assertThat(InvoiceStatus.PROCESSED.canTransitionTo(InvoiceStatus.ERROR)).isTrue();
        assertThat(InvoiceStatus.DRAFT.canTransitionTo(InvoiceStatus.ERROR)).isFalse();
        assertThat(InvoiceStatus.ERROR.allowedTransitions()).containsExactly(InvoiceStatus.PENDING);
    }

    @Test
    void archivedIsTerminal() {
        assertThat(InvoiceStatus.PROCESSED.canTransitionTo(InvoiceStatus.ARCHIVED)).isTrue();
        assertThat(InvoiceStatus.SENT_TO_ACCOUNTING.canTransitionTo(InvoiceStatus.ARCHIVED)).isTrue();
        assertThat(InvoiceStatus.ARCHIVED.isTerminal()).isTrue();
        assertThatThrownBy(() -> InvoiceStatus.ARCHIVED.requireTransitionTo(InvoiceStatus.PENDING))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void readsWireValues() {
        assertThat(InvoiceStatus.fromWire("sent_to_qb")).isEqualTo(InvoiceStatus.SENT_TO_ACCOUNTING);
        assertThatThrownBy(() -> InvoiceStatus.fromWire("lost")).isInstanceOf(ValidationException.class);
    }
}
