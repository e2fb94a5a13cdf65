package io.rowcheck.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: an abstract root, load-time errors and processing errors. */
class ExceptionHierarchyTest {

    @Test
    void rowCheckExceptionIsAbstractAndRoot() {
        assertThat(RowCheckException.class).isAbstract();
        assertThat(RowCheckException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void schemaLoadExceptionIsAbstract() {
        assertThat(SchemaLoadException.class).isAbstract();
        assertThat(SchemaLoadException.class.getSuperclass()).isEqualTo(RowCheckException.class);
    }

    @Test
    void schemaParseExceptionExtendsLoadException() {
        var cause = new RuntimeException("mapping values are not allowed here");
        var ex = new SchemaParseException("bad yaml", cause, "/path/to/schema.yaml");

        assertThat(ex).isInstanceOf(SchemaLoadException.class);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.detail()).isEqualTo("bad yaml");
        assertThat(ex.phase()).isEqualTo(RowCheckException.Phase.LOAD);
        assertThat(ex.source()).isEqualTo("/path/to/schema.yaml");
    }

    @Test
    void schemaDefinitionExceptionCarriesRuleAndKey() {
        var ex = new SchemaDefinitionException("Unknown key 'foo'", 2, "foo", "/schema.yaml");

        assertThat(ex).isInstanceOf(SchemaLoadException.class);
        assertThat(ex.phase()).isEqualTo(RowCheckException.Phase.LOAD);
        assertThat(ex.ruleIndex()).isEqualTo(2);
        assertThat(ex.key()).isEqualTo("foo");
        assertThat(ex.source()).isEqualTo("/schema.yaml");
    }

    @Test
    void recordReadExceptionIsProcessingPhase() {
        var ex = new RecordReadException("unterminated quote", 17);

        assertThat(ex).isInstanceOf(RowCheckException.class);
        assertThat(ex).isNotInstanceOf(SchemaLoadException.class);
        assertThat(ex.phase()).isEqualTo(RowCheckException.Phase.PROCESSING);
        assertThat(ex.recordNumber()).isEqualTo(17);
    }
}
