package com.cssast.jackson;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.cssast.ast.*;

import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the CSS AST classes.
 *
 * This module handles:
 * - Polymorphic node handling via the "kind" property
 * - Constructor-based creation of the mutable node classes
 * - Mappings written with both sides present, even when a side is null
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, null, "com.cssast", "cadenza-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling
        context.setMixInAnnotations(AstNode.class, AstNodeMixin.class);

        context.setMixInAnnotations(Rule.class, RuleMixin.class);
        context.setMixInAnnotations(Declaration.class, DeclarationMixin.class);
        context.setMixInAnnotations(Comment.class, CommentMixin.class);

        // An absent source or destination is meaningful to source map consumers
        context.setMixInAnnotations(Mapping.class, MappingMixin.class);
    }

    // ==================== Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Rule.class, name = "rule"),
        @JsonSubTypes.Type(value = Declaration.class, name = "declaration"),
        @JsonSubTypes.Type(value = Comment.class, name = "comment")
    })
    private interface AstNodeMixin {
    }

    private abstract static class RuleMixin {
        @JsonCreator
        RuleMixin(@JsonProperty("selector") String selector,
                  @JsonProperty("nodes") @JsonSetter(nulls = Nulls.AS_EMPTY) List<? extends AstNode> nodes,
                  @JsonProperty("mappings") @JsonSetter(nulls = Nulls.AS_EMPTY) List<Mapping> mappings) {
        }

        // Derived from the selector
        @JsonIgnore
        abstract boolean isAtRule();
    }

    private abstract static class DeclarationMixin {
        @JsonCreator
        DeclarationMixin(@JsonProperty("property") String property,
                         @JsonProperty("value") String value,
                         @JsonProperty("mappings") @JsonSetter(nulls = Nulls.AS_EMPTY) List<Mapping> mappings) {
        }
    }

    private abstract static class CommentMixin {
        @JsonCreator
        CommentMixin(@JsonProperty("value") String value,
                     @JsonProperty("mappings") @JsonSetter(nulls = Nulls.AS_EMPTY) List<Mapping> mappings) {
        }
    }

    private abstract static class MappingMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Range source();
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Range destination();
    }
}
