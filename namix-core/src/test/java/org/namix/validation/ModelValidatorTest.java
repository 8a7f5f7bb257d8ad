package org.namix.validation;

import org.namix.convention.ConventionSet;
import org.namix.model.ConfigurationSource;
import org.namix.model.EntityModel;
import org.namix.model.SchemaModel;
import org.namix.naming.SnakeCaseNameRewriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelValidatorTest {

    private final ModelValidator validator = new ModelValidator();
    private SchemaModel model;

    @BeforeEach
    void setUp() {
        model = new SchemaModel(ConventionSet.withNameRewriting(new SnakeCaseNameRewriter(Locale.ROOT)));
    }

    private EntityModel entityWithKey(SchemaModel target, String name) {
        EntityModel entity = target.addEntity(name);
        entity.addProperty("Id");
        entity.setPrimaryKey("Id");
        return entity;
    }

    @Test
    @DisplayName("충돌이 없으면 문제를 보고하지 않는다")
    void validModel() {
        EntityModel customer = entityWithKey(model, "Customer");
        EntityModel order = entityWithKey(model, "Order");
        order.addForeignKey(List.of(order.addProperty("CustomerId")), customer);
        order.addIndex("CustomerId");
        model.finalizeModel();

        assertThat(validator.findProblems(model)).isEmpty();
    }

    @Test
    @DisplayName("서로 다른 테이블의 키가 같은 이름을 쓰면 충돌이다")
    void duplicateKeyNames() {
        entityWithKey(model, "Customer").findPrimaryKey().setName("PK_same", ConfigurationSource.EXPLICIT);
        entityWithKey(model, "Order").findPrimaryKey().setName("PK_same", ConfigurationSource.EXPLICIT);
        model.finalizeModel();

        assertThatThrownBy(() -> validator.validate(model))
                .isInstanceOf(ModelValidationException.class)
                .satisfies(e -> assertThat(((ModelValidationException) e).getProblems())
                        .containsExactly("Key name 'PK_same' is used by customer and order"));
    }

    @Test
    @DisplayName("TPT 계층에 기본 키 이름 재정의가 남아 있으면 테이블마다 같은 이름이 된다")
    void tablePerTypeWithSharedKeyName() {
        SchemaModel plain = new SchemaModel(ConventionSet.createDefault());
        EntityModel animal = entityWithKey(plain, "Animal");
        animal.findPrimaryKey().setName("PK_Animal", ConfigurationSource.CONVENTION);
        EntityModel dog = plain.addEntity("Dog");
        dog.setBaseType(animal);
        dog.setTableName("Dogs", ConfigurationSource.EXPLICIT);
        plain.finalizeModel();

        assertThat(validator.findProblems(plain))
                .containsExactly("Key name 'PK_Animal' is used by Animal and Dogs");
    }

    @Test
    @DisplayName("서로 다른 테이블의 외래 키가 같은 이름을 쓰면 충돌이다")
    void duplicateForeignKeyNames() {
        EntityModel customer = entityWithKey(model, "Customer");
        EntityModel order = entityWithKey(model, "Order");
        EntityModel invoice = entityWithKey(model, "Invoice");
        order.addForeignKey(List.of(order.addProperty("CustomerId")), customer)
                .setConstraintName("FK_customer", ConfigurationSource.EXPLICIT);
        invoice.addForeignKey(List.of(invoice.addProperty("CustomerId")), customer)
                .setConstraintName("FK_customer", ConfigurationSource.EXPLICIT);
        model.finalizeModel();

        assertThat(validator.findProblems(model))
                .containsExactly("Foreign key name 'FK_customer' is used by order and invoice");
    }

    @Test
    @DisplayName("같은 테이블의 두 외래 키가 같은 이름을 쓰면 충돌이다")
    void duplicateForeignKeyNamesOnOneTable() {
        EntityModel customer = entityWithKey(model, "Customer");
        EntityModel order = entityWithKey(model, "Order");
        order.addForeignKey(List.of(order.addProperty("CustomerId")), customer)
                .setConstraintName("FK_dup", ConfigurationSource.EXPLICIT);
        order.addForeignKey(List.of(order.addProperty("BuyerId")), customer)
                .setConstraintName("FK_dup", ConfigurationSource.EXPLICIT);
        model.finalizeModel();

        assertThat(validator.findProblems(model))
                .containsExactly("Foreign key name 'FK_dup' is used twice on order");
    }

    @Test
    @DisplayName("인덱스 이름은 같은 정의끼리만 공유할 수 있다")
    void indexNames() {
        EntityModel order = entityWithKey(model, "Order");
        order.addProperty("Number");
        order.addIndex("Number").setDatabaseName("IX_number", ConfigurationSource.EXPLICIT);
        order.addIndex("Number").setDatabaseName("IX_number", ConfigurationSource.EXPLICIT);
        EntityModel invoice = entityWithKey(model, "Invoice");
        invoice.addProperty("Number");
        invoice.addIndex("Number").setDatabaseName("IX_number", ConfigurationSource.EXPLICIT);
        model.finalizeModel();

        assertThat(validator.findProblems(model))
                .containsExactly("Index name 'IX_number' is used by different indexes on order and invoice");
    }
}
