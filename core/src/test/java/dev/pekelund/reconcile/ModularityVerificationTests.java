package dev.pekelund.reconcile;

import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModules;

class ModularityVerificationTests {

    @Test
    void coreModulesShouldRespectDeclaredBoundaries() {
        ApplicationModules.of("dev.pekelund.reconcile").verify();
    }
}
