package org.namix.model;

import org.namix.convention.ConventionSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertyModelTest {

    private SchemaModel model;
    private EntityModel person;

    @BeforeEach
    void setUp() {
        model = new SchemaModel(ConventionSet.empty());
        person = model.addEntity("Person");
        person.addProperty("Id");
        person.setPrimaryKey("Id");
    }

    private EntityModel ownedBy(EntityModel owner, String name, String navigation) {
        EntityModel owned = model.addEntity(name);
        owned.addProperty("OwnerId");
        owned.setPrimaryKey("OwnerId");
        ForeignKeyModel ownership = owned.addForeignKey(List.of(owned.getProperty("OwnerId")), owner);
        if (navigation != null) {
            ownership.setPrincipalToDependent(navigation, false);
        }
        ownership.setOwnership(true);
        return owned;
    }

    @Nested
    @DisplayName("기본 컬럼 이름")
    class DefaultColumnNames {

        @Test
        @DisplayName("소유되지 않은 속성은 속성 이름")
        void plainProperty() {
            PropertyModel name = person.addProperty("Name");

            assertThat(name.getColumnBaseName()).isEqualTo("Name");
            assertThat(name.getColumnName(StoreObjectIdentifier.table("Person", null))).isEqualTo("Name");
        }

        @Test
        @DisplayName("테이블 분할된 소유 엔티티의 속성은 내비게이션 이름을 접두사로 가진다")
        void ownedPrefix() {
            EntityModel address = ownedBy(person, "Address", null);
            PropertyModel street = address.addProperty("Street");

            StoreObjectIdentifier table = StoreObjectIdentifier.create(address, StoreObjectType.TABLE);

            assertThat(table.name()).isEqualTo("Person");
            assertThat(street.getDefaultColumnName(table)).isEqualTo("Address_Street");
        }

        @Test
        @DisplayName("내비게이션 이름이 설정되면 그것을 접두사로 쓴다")
        void navigationPrefix() {
            EntityModel address = ownedBy(person, "Address", "HomeAddress");
            PropertyModel street = address.addProperty("Street");

            assertThat(street.getDefaultColumnName(StoreObjectIdentifier.table("Person", null)))
                    .isEqualTo("HomeAddress_Street");
        }

        @Test
        @DisplayName("중첩 소유는 바깥쪽 내비게이션부터 접두사를 쌓는다")
        void nestedOwnership() {
            EntityModel address = ownedBy(person, "Address", null);
            EntityModel geo = ownedBy(address, "Geo", null);
            PropertyModel latitude = geo.addProperty("Lat");

            assertThat(latitude.getDefaultColumnName(StoreObjectIdentifier.table("Person", null)))
                    .isEqualTo("Address_Geo_Lat");
        }

        @Test
        @DisplayName("분할된 소유 엔티티의 기본 키는 소유자의 키 컬럼을 공유한다")
        void sharedKeyColumn() {
            EntityModel address = ownedBy(person, "Address", null);

            assertThat(address.getProperty("OwnerId").getColumnName(StoreObjectIdentifier.table("Person", null)))
                    .isEqualTo("Id");
        }

        @Test
        @DisplayName("별도 테이블을 가진 소유 엔티티는 접두사가 없다")
        void ownedWithOwnTable() {
            EntityModel address = ownedBy(person, "Address", null);
            address.setTableName("Addresses", ConfigurationSource.EXPLICIT);
            PropertyModel street = address.addProperty("Street");

            assertThat(street.getColumnName(StoreObjectIdentifier.table("Addresses", null))).isEqualTo("Street");
        }
    }

    @Nested
    @DisplayName("저장 객체별 컬럼 이름")
    class StoreObjectOverrides {

        @Test
        @DisplayName("저장 객체별 값이 없으면 기본 컬럼 이름의 출처를 따른다")
        void fallsBackToBase() {
            PropertyModel name = person.addProperty("Name");
            StoreObjectIdentifier view = StoreObjectIdentifier.view("PersonView", null);
            name.setColumnName("full_name", ConfigurationSource.CONVENTION);

            assertThat(name.getColumnName(view)).isEqualTo("full_name");
            assertThat(name.isConventionSourced(view)).isTrue();

            name.setColumnName("FULL_NAME", view, ConfigurationSource.EXPLICIT);

            assertThat(name.getColumnName(view)).isEqualTo("FULL_NAME");
            assertThat(name.getColumnNameConfigurationSource(view)).isEqualTo(ConfigurationSource.EXPLICIT);
            assertThat(name.removeColumnName(view, ConfigurationSource.CONVENTION)).isFalse();
            assertThat(name.getColumnNameOverrides()).containsKey(view);
        }

        @Test
        @DisplayName("EXPLICIT 기본 컬럼 이름은 CONVENTION 으로 바꿀 수 없다")
        void explicitBase() {
            PropertyModel name = person.addProperty("Name");
            name.setColumnName("PERSON_NAME", ConfigurationSource.EXPLICIT);

            assertThat(name.canSetColumnName(ConfigurationSource.CONVENTION)).isFalse();
            assertThat(name.setColumnName("name", ConfigurationSource.CONVENTION)).isFalse();
            assertThat(name.getColumnBaseName()).isEqualTo("PERSON_NAME");
        }

        @Test
        @DisplayName("빈 컬럼 이름은 거부한다")
        void rejectsBlank() {
            PropertyModel name = person.addProperty("Name");

            assertThatThrownBy(() -> name.setColumnName(" ", ConfigurationSource.EXPLICIT))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
