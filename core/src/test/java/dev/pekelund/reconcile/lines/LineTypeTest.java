package dev.pekelund.reconcile.lines;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class LineTypeTest {

    @Test
    void classifiesByAmountsAndKeywords() {
        assertThat(LineType.detect("Beef striploin", BigDecimal.ONE, new BigDecimal("35.50")))
            .isEqualTo(LineType.PRODUCT);
        assertThat(LineType.detect("Consigne bouteilles", new BigDecimal("24"), new BigDecimal("2.40")))
            .isEqualTo(LineType.DEPOSIT);
        assertThat(LineType.detect("Frais de livraison", BigDecimal.ONE, new BigDecimal("15.00")))
            .isEqualTo(LineType.FEE);
        assertThat(LineType.detect("Returned case", BigDecimal.ONE, new BigDecimal("-20.00")))
            .isEqualTo(LineType.CREDIT);
        assertThat(LineType.detect("Out of stock", BigDecimal.ZERO, BigDecimal.ZERO)).isEqualTo(LineType.ZERO);
    }

    @Test
    void routesOnlyProductsToInventory() {
        assertThat(LineType.PRODUCT.forInventory()).isTrue();
        assertThat(LineType.FEE.forInventory()).isFalse();
        assertThat(LineType.FEE.forAccounting()).isTrue();
        assertThat(LineType.DEPOSIT.forAccounting()).isFalse();
    }
}
