package com.phillippitts.cabinassist.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void baseExceptionKeepsMessageAndCause() {
        IOException cause = new IOException("disk");
        CabinAssistException ex = new CabinAssistException("wrapper", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void allDomainExceptionsShareBase() {
        assertThat(new SchemaMismatchException("entities", "bad")).isInstanceOf(CabinAssistException.class);
        assertThat(new CommandExecutionException("media", "bad")).isInstanceOf(CabinAssistException.class);
        assertThat(new ComponentFailureException("down", "tts")).isInstanceOf(CabinAssistException.class);
        assertThat(new IntegrityCheckException("tampered")).isInstanceOf(CabinAssistException.class);
        assertThat(new RecoveryFailedException(List.of("nlu"))).isInstanceOf(CabinAssistException.class);
    }

    @Test
    void schemaMismatchNamesField() {
        SchemaMismatchException ex = new SchemaMismatchException("vehicleState.climate_control", "expected a mapping");

        assertThat(ex.getMessage()).contains("vehicleState.climate_control").contains("expected a mapping");
    }

    @Test
    void componentFailureNamesComponent() {
        ComponentFailureException ex = new ComponentFailureException("timed out", "nlu", new IOException("socket"));

        assertThat(ex.getComponentName()).isEqualTo("nlu");
        assertThat(ex.getCause()).isInstanceOf(IOException.class);
    }

    @Test
    void recoveryFailureListsComponentsImmutably() {
        RecoveryFailedException ex = new RecoveryFailedException(List.of("nlu", "tts"));

        assertThat(ex.getFailedComponents()).containsExactly("nlu", "tts");
        assertThat(ex.getMessage()).contains("nlu", "tts");
    }
}
