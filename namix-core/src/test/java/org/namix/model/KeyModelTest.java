package org.namix.model;

import org.namix.convention.ConventionSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeyModelTest {

    private SchemaModel model;

    @BeforeEach
    void setUp() {
        model = new SchemaModel(ConventionSet.empty());
    }

    @Test
    @DisplayName("TPT 계층의 기본 키 이름은 테이블마다 따로 계산된다")
    void tablePerTypeKeyNames() {
        EntityModel animal = model.addEntity("Animal");
        animal.addProperty("Id");
        KeyModel key = animal.setPrimaryKey("Id");
        EntityModel dog = model.addEntity("Dog");
        dog.setBaseType(animal);
        dog.setTableName("Dogs", ConfigurationSource.EXPLICIT);

        assertThat(key.getName(StoreObjectIdentifier.table("Animal", null))).isEqualTo("PK_Animal");
        assertThat(key.getName(StoreObjectIdentifier.table("Dogs", null))).isEqualTo("PK_Dogs");
        assertThat(key.getName(StoreObjectIdentifier.table("Other", null))).isNull();
    }

    @Test
    @DisplayName("이름을 설정하면 모든 테이블에서 그 이름을 쓴다")
    void overrideAppliesEverywhere() {
        EntityModel animal = model.addEntity("Animal");
        animal.addProperty("Id");
        KeyModel key = animal.setPrimaryKey("Id");
        EntityModel dog = model.addEntity("Dog");
        dog.setBaseType(animal);
        dog.setTableName("Dogs", ConfigurationSource.EXPLICIT);

        key.setName("pk_animal", ConfigurationSource.CONVENTION);

        assertThat(key.getName(StoreObjectIdentifier.table("Dogs", null))).isEqualTo("pk_animal");
        assertThat(key.removeName(ConfigurationSource.CONVENTION)).isTrue();
        assertThat(key.findNameAnnotation()).isNull();
    }

    @Test
    @DisplayName("테이블 분할된 엔티티의 기본 키는 주체의 제약 조건 이름을 쓴다")
    void splitKeySharesPrincipalName() {
        EntityModel person = model.addEntity("Person");
        person.addProperty("Id");
        KeyModel personKey = person.setPrimaryKey("Id");
        personKey.setName("pk_person", ConfigurationSource.EXPLICIT);
        EntityModel address = model.addEntity("Address");
        address.addProperty("PersonId");
        KeyModel addressKey = address.setPrimaryKey("PersonId");
        address.addForeignKey(List.of(address.getProperty("PersonId")), person).setOwnership(true);

        StoreObjectIdentifier table = StoreObjectIdentifier.table("Person", null);

        assertThat(address.findRowInternalForeignKey(table)).isNotNull();
        assertThat(addressKey.getName(table)).isEqualTo("pk_person");
    }

    @Test
    @DisplayName("대체 키 기본 이름은 컬럼 이름을 포함한다")
    void alternateKeyDefault() {
        EntityModel customer = model.addEntity("Customer");
        customer.addProperty("Email").setColumnName("email_address", ConfigurationSource.EXPLICIT);

        KeyModel key = customer.addKey("Email");

        assertThat(key.getName()).isEqualTo("AK_Customer_email_address");
    }
}
