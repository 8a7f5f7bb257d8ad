package org.namix.naming;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultNamingTest {

    private DefaultNaming naming;

    @BeforeEach
    void setUp() {
        naming = new DefaultNaming(63);
    }

    @Nested
    @DisplayName("기본 이름 형식")
    class Formats {

        @Test
        @DisplayName("PK_<table>")
        void primaryKey() {
            assertThat(naming.pkName("Customer")).isEqualTo("PK_Customer");
        }

        @Test
        @DisplayName("AK_<table>_<columns>")
        void alternateKey() {
            assertThat(naming.akName("Customer", List.of("Email", "TenantId"))).isEqualTo("AK_Customer_Email_TenantId");
        }

        @Test
        @DisplayName("FK_<table>_<principal>_<columns>")
        void foreignKey() {
            assertThat(naming.fkName("Order", "Customer", List.of("CustomerId")))
                    .isEqualTo("FK_Order_Customer_CustomerId");
        }

        @Test
        @DisplayName("IX_<table>_<columns> 는 컬럼 순서를 유지한다")
        void index() {
            assertThat(naming.ixName("Order", List.of("B", "A"))).isEqualTo("IX_Order_B_A");
        }

        @Test
        @DisplayName("컬럼 목록이 비어있으면 테이블 이름까지만")
        void noColumns() {
            assertThat(naming.ixName("Order", List.of())).isEqualTo("IX_Order");
        }
    }

    @Nested
    @DisplayName("길이 제한")
    class Clamping {

        @Test
        @DisplayName("최대 길이를 넘으면 해시 접미사로 잘라낸다")
        void clampsWithHash() {
            DefaultNaming shortNaming = new DefaultNaming(20);

            String name = shortNaming.fkName("VeryLongOrderTable", "VeryLongCustomerTable", List.of("CustomerId"));

            assertThat(name).hasSize(20);
            assertThat(name).matches("FK_VeryLong_[0-9a-f]{8}");
        }

        @Test
        @DisplayName("같은 입력은 같은 해시를 만든다")
        void stableHash() {
            DefaultNaming shortNaming = new DefaultNaming(20);

            assertThat(shortNaming.truncate("SomeVeryLongColumnNameThatNeedsClamping"))
                    .isEqualTo(shortNaming.truncate("SomeVeryLongColumnNameThatNeedsClamping"));
        }

        @Test
        @DisplayName("접두사가 같아도 다른 이름은 다르게 잘린다")
        void distinctNames() {
            DefaultNaming shortNaming = new DefaultNaming(20);

            assertThat(shortNaming.truncate("SharedPrefixColumnNumberOne"))
                    .isNotEqualTo(shortNaming.truncate("SharedPrefixColumnNumberTwo"));
        }

        @Test
        @DisplayName("제한 이내의 이름과 null 은 그대로")
        void untouched() {
            assertThat(naming.truncate("Street")).isEqualTo("Street");
            assertThat(naming.truncate(null)).isNull();
        }

        @Test
        @DisplayName("16 미만의 최대 길이는 거부한다")
        void rejectsTinyLimit() {
            assertThatThrownBy(() -> new DefaultNaming(10))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
