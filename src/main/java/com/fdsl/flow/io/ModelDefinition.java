package com.fdsl.flow.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fdsl.flow.expr.ExprAst;

import lombok.Data;

/**
 * POJO representation of a validated FDSL metamodel: entities, sources and
 * endpoints, with attribute expressions already parsed into {@link ExprAst}
 * trees.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ModelDefinition {
    private String name;
    private List<EntityDef> entities = new ArrayList<>();
    private List<SourceDef> sources = new ArrayList<>();
    private List<EndpointDef> endpoints = new ArrayList<>();

    /** A named record type, either pure schema, source-bound or composite. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class EntityDef {
        private String name;
        private List<AttributeDef> attributes = new ArrayList<>();
        private List<ParentDef> parents = new ArrayList<>();
        /** Read or subscribe source that populates this entity. */
        private String source;
        /** Write or publish source this entity is sent to. */
        private String target;
        /** Entity value is a list of records. */
        private boolean many;
        /** Explicit primitive wrapper marker. */
        private boolean wrapper;
        /** Access-control metadata, carried through untouched. */
        private Map<String, Object> access;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class AttributeDef {
        private String name;
        private String type;
        private boolean nullable;
        private boolean primaryKey;
        private ExprAst expr;
    }

    /** Parent reference of a composite entity. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ParentDef {
        private String entity;
        private boolean many;
        /** Field of the first parent used to look this parent up; overrides inference. */
        private String key;
    }

    /** External REST or WebSocket endpoint the engine reads from or writes to. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class SourceDef {
        private String name;
        private String transport;
        private String direction;
        private String url;
        private String method;
        /** Entity exchanged with the source: provided for read/subscribe, response for write, payload for publish. */
        private String entity;
        /** Payload entity of a write source. */
        private String request;
        private List<ParamDef> params = new ArrayList<>();
        /** Primitive content type, marks the exchanged entity as a wrapper. */
        private String valueType;
    }

    /** Named parameter; sources compute it from an expression, endpoints receive it from the client. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ParamDef {
        private String name;
        private String type;
        private ExprAst expr;
    }

    /** Client-facing REST or WebSocket surface. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class EndpointDef {
        private String name;
        private String transport;
        private String method;
        private String path;
        private List<ParamDef> params = new ArrayList<>();
        private String request;
        private String response;
        private String clientPublish;
        private String clientSubscribe;
        private String valueType;
    }
}
