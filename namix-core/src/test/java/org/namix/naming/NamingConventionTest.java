package org.namix.naming;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NamingConventionTest {

    @Nested
    @DisplayName("문자열 파싱")
    class Parsing {

        @ParameterizedTest
        @CsvSource({
            "snake_case, SNAKE_CASE",
            "snake-case, SNAKE_CASE",
            "UPPER_SNAKE_CASE, UPPER_SNAKE_CASE",
            "camel_case, CAMEL_CASE",
            "' none ', NONE"
        })
        @DisplayName("여러 표기법을 허용한다")
        void acceptsSpellings(String input, NamingConvention expected) {
            assertThat(NamingConvention.fromString(input)).isEqualTo(expected);
        }

        @Test
        @DisplayName("알 수 없는 컨벤션은 IllegalArgumentException")
        void unknown() {
            assertThatThrownBy(() -> NamingConvention.fromString("kebab"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("kebab");
        }

        @Test
        @DisplayName("빈 값은 IllegalArgumentException")
        void blank() {
            assertThatThrownBy(() -> NamingConvention.fromString(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Rewriter 생성")
    class Rewriters {

        @ParameterizedTest
        @CsvSource({
            "NONE, OrderLine",
            "SNAKE_CASE, order_line",
            "LOWER_CASE, orderline",
            "UPPER_CASE, ORDERLINE",
            "UPPER_SNAKE_CASE, ORDER_LINE",
            "CAMEL_CASE, orderLine"
        })
        @DisplayName("각 컨벤션의 변환 결과")
        void rewrites(NamingConvention convention, String expected) {
            NameRewriter rewriter = convention.createRewriter(Locale.ROOT);

            assertThat(rewriter.rewriteName("OrderLine")).isEqualTo(expected);
        }

        @Test
        @DisplayName("모든 rewriter 는 null 과 빈 문자열을 그대로 반환한다")
        void nullSafe() {
            for (NamingConvention convention : NamingConvention.values()) {
                NameRewriter rewriter = convention.createRewriter(Locale.ROOT);
                assertThat(rewriter.rewriteName(null)).as(convention.name()).isNull();
                assertThat(rewriter.rewriteName("")).as(convention.name()).isEmpty();
            }
        }
    }

    @Test
    @DisplayName("displayName 은 소문자 이름")
    void displayName() {
        assertThat(NamingConvention.UPPER_SNAKE_CASE.displayName()).isEqualTo("upper_snake_case");
    }
}
