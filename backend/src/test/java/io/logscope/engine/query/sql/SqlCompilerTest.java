package io.logscope.engine.query.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.logscope.engine.query.FieldRegistry;
import io.logscope.engine.query.parser.ExpressionParser;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class SqlCompilerTest {

    private ExpressionParser parser;
    private SqlCompiler compiler;

    @BeforeEach
    void setUp() {
        FieldRegistry registry = FieldRegistry.defaults();
        parser = new ExpressionParser(registry);
        compiler = new SqlCompiler(registry);
    }

    private CompiledFilter compile(String expression) {
        return compiler.compile(parser.parse(expression));
    }

    @Test
    void comparesStringFieldsCaseInsensitively() {
        CompiledFilter filter = compile("level == \"ERROR\"");

        assertThat(filter.sql()).isEqualTo("(lower(level) = ?)");
        assertThat(filter.args()).containsExactly("error");
    }

    @Test
    void combinesEqualityAndContains() {
        CompiledFilter filter = compile("level == \"error\" and message contains \"timeout\"");

        assertThat(filter.sql()).isEqualTo("((lower(level) = ?) AND position(lower(message), ?) > 0)");
        assertThat(filter.args()).containsExactly("error", "timeout");
    }

    @Test
    void membershipBindsEveryElement() {
        CompiledFilter filter = compile("level in [\"error\", \"warning\"]");

        assertThat(filter.sql()).isEqualTo("level IN (?, ?)");
        assertThat(filter.args()).containsExactlyInAnyOrder("error", "warning");
    }

    @Test
    void notInNegatesMembership() {
        CompiledFilter filter = compile("type not in [\"nginx\"]");

        assertThat(filter.sql()).isEqualTo("NOT (type IN (?))");
        assertThat(filter.args()).containsExactly("nginx");
    }

    @Test
    void jsonMemberAccessExtractsProperty() {
        CompiledFilter filter = compile("fields.status == \"200\"");

        assertThat(filter.sql()).isEqualTo("(JSONExtractString(fields, 'status') = ?)");
        assertThat(filter.args()).containsExactly("200");
    }

    @Test
    void relativeTimeUsesInlineInterval() {
        CompiledFilter filter = compile("timestamp > now() - duration(\"1h\")");

        assertThat(filter.sql()).isEqualTo("(timestamp > (now() - INTERVAL 1 HOUR))");
        assertThat(filter.args()).isEmpty();
    }

    @Test
    void numericComparisonsBindNumbers() {
        CompiledFilter filter = compile("http_status >= 500 and http_status != 503");

        assertThat(filter.sql()).isEqualTo("((http_status >= ?) AND (http_status != ?))");
        assertThat(filter.args()).containsExactly(500L, 503L);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "message startsWith \"Conn\" | startsWith(lower(message), ?) | conn",
            "uri endsWith \".PNG\"       | endsWith(lower(uri), ?)         | .png",
            "message matches \"^ERR.*\"  | match(lower(message), ?)        | ^err.*"
    })
    void stringPredicatesLowerBothSides(String expression, String sql, String arg) {
        CompiledFilter filter = compile(expression);

        assertThat(filter.sql()).isEqualTo(sql);
        assertThat(filter.args()).containsExactly(arg);
    }

    @Test
    void negationWrapsOperand() {
        CompiledFilter filter = compile("not (level == \"debug\")");

        assertThat(filter.sql()).isEqualTo("NOT ((lower(level) = ?))");
    }

    @Test
    void nilComparisonsBecomeNullChecks() {
        assertThat(compile("fields.user == nil").sql()).isEqualTo("(JSONExtractString(fields, 'user') IS NULL)");
        assertThat(compile("fields.user != nil").sql()).isEqualTo("(JSONExtractString(fields, 'user') IS NOT NULL)");
    }

    @Test
    void stringFunctionsAreTranslated() {
        CompiledFilter filter = compile("len(message) == 100");

        assertThat(filter.sql()).isEqualTo("(length(message) = ?)");
        assertThat(filter.args()).containsExactly(100L);
        assertThat(compile("lower(source) contains \"API\"").sql())
                .isEqualTo("position(lower(lower(source)), ?) > 0");
    }

    @Test
    void wrappedFieldsKeepTheirOperatorTable() {
        assertThatThrownBy(() -> compile("lower(level) matches \".*\""))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("operator 'matches' is not allowed for field 'level'");
        assertThatThrownBy(() -> compile("len(timestamp) == 5"))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("operator '==' is not allowed for field 'timestamp'");
        assertThatThrownBy(() -> compile("len(message) > 100"))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("operator '>' is not allowed for field 'message'");
    }

    @Test
    void wrappedFieldsKeepTheirLiteralTypes() {
        assertThatThrownBy(() -> compile("http_status + 0 == \"abc\""))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("cannot compare field 'http_status'");
        assertThatThrownBy(() -> compile("len(message) == \"long\""))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("cannot compare field 'message' (int)");

        CompiledFilter filter = compile("http_status + 0 >= 500");
        assertThat(filter.sql()).isEqualTo("((http_status + ?) >= ?)");
        assertThat(filter.args()).containsExactly(0L, 500L);
    }

    @Test
    void literalsNeverAppearInSql() {
        CompiledFilter filter = compile(
                "message contains \"'; DROP TABLE logs; --\" or source == \"x') OR 1=1 --\"");

        assertThat(filter.sql()).doesNotContain("DROP").doesNotContain("1=1");
        assertThat(filter.args()).containsExactly("'; drop table logs; --", "x') or 1=1 --");
    }

    @Test
    void disallowedOperatorIsRejected() {
        assertThatThrownBy(() -> compile("level contains \"err\""))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("operator 'contains' is not allowed for field 'level'");
        assertThatThrownBy(() -> compile("timestamp == now()"))
                .isInstanceOf(CompileException.class);
    }

    @Test
    void memberAccessOnlyOnJsonFields() {
        assertThatThrownBy(() -> compile("level.name == \"x\""))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("does not support member access");
        assertThatThrownBy(() -> compile("fields == \"x\""))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("member access only");
    }

    @ParameterizedTest
    @ValueSource(strings = {"status'--", "a b", "x)y", "na\"me", "k8s.pod-name", "a.b"})
    void rejectsUnsafePropertyNames(String property) {
        assertThatThrownBy(() -> compile("fields[\"" + property.replace("\"", "\\\"") + "\"] == \"1\""))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("invalid property name");
    }

    @Test
    void acceptsDashedAndUnderscoredPropertyNames() {
        assertThat(compile("labels[\"pod-name_2\"] == \"api-1\"").sql())
                .isEqualTo("(JSONExtractString(labels, 'pod-name_2') = ?)");
    }

    @Test
    void quotedDotPropertiesGoThroughTheAllowList() {
        assertThat(compile("fields.\"status\" == \"200\"").sql())
                .isEqualTo("(JSONExtractString(fields, 'status') = ?)");
        assertThatThrownBy(() -> compile("fields.\"bad; DROP\" == \"1\""))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("invalid property name 'bad; DROP'");
    }

    @Test
    void rejectsIncompatibleLiterals() {
        assertThatThrownBy(() -> compile("http_status == \"500\""))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("http_status");
        assertThatThrownBy(() -> compile("level == 3"))
                .isInstanceOf(CompileException.class);
        assertThatThrownBy(() -> compile("timestamp > \"2024-01-01\""))
                .isInstanceOf(CompileException.class);
        assertThatThrownBy(() -> compile("level in [\"error\", 5]"))
                .isInstanceOf(CompileException.class);
    }

    @Test
    void predicatesRequireStringLiteral() {
        assertThatThrownBy(() -> compile("message contains source"))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("string literal");
    }

    @ParameterizedTest
    @ValueSource(strings = {"(a+)+", "(a*)*", "(a|b)*", "(x+)*y", "(a|aa){2,}", "((a+))+", "((ab)+)+",
            "((a|b))*", "(a{2,})+", "(?:x(y+)z)*"})
    void rejectsCatastrophicRegex(String pattern) {
        assertThatThrownBy(() -> compile("message matches \"" + pattern + "\""))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("nested quantifiers");
    }

    @Test
    void rejectsInvalidRegex() {
        assertThatThrownBy(() -> compile("message matches \"[unclosed\""))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("invalid regex");
    }

    @Test
    void rejectsUnsupportedFunctionsAndBadDurations() {
        assertThatThrownBy(() -> compile("sleep(5) == 1"))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("unsupported function 'sleep'");
        assertThatThrownBy(() -> compile("timestamp > now() - duration(\"5 parsecs\")"))
                .isInstanceOf(CompileException.class);
        assertThatThrownBy(() -> compile("timestamp > now() - duration(\"-1h\")"))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void argumentOrderFollowsSqlOrder() {
        CompiledFilter filter = compile(
                "(source == \"b\" or agent_id in [\"a1\"]) and http_status < 400 and fields.user == \"Bob\"");

        assertThat(filter.sql()).isEqualTo(
                "((((lower(source) = ?) OR agent_id IN (?)) AND (http_status < ?)) "
                        + "AND (JSONExtractString(fields, 'user') = ?))");
        assertThat(filter.args()).isEqualTo(List.of("b", "a1", 400L, "bob"));
    }
}
