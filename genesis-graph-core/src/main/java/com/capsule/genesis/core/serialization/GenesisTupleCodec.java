/*
 * GenesisTupleCodec.java
 *
 * This source file is part of the Genesis Graph open source project
 *
 * Copyright 2024-2026 the Genesis Graph project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.capsule.genesis.core.serialization;

import com.apple.foundationdb.tuple.ByteArrayUtil;
import com.apple.foundationdb.tuple.Tuple;
import com.capsule.genesis.annotation.API;
import com.capsule.genesis.core.expressions.ApplyExpression;
import com.capsule.genesis.core.expressions.Expression;
import com.capsule.genesis.core.expressions.LambdaExpression;
import com.capsule.genesis.core.expressions.LetExpression;
import com.capsule.genesis.core.expressions.LinearApplyExpression;
import com.capsule.genesis.core.expressions.ListExpression;
import com.capsule.genesis.core.expressions.Literal;
import com.capsule.genesis.core.expressions.LiteralExpression;
import com.capsule.genesis.core.expressions.MatchArm;
import com.capsule.genesis.core.expressions.MatchExpression;
import com.capsule.genesis.core.expressions.RecordExpression;
import com.capsule.genesis.core.expressions.TupleExpression;
import com.capsule.genesis.core.expressions.VarExpression;
import com.capsule.genesis.core.graph.EdgeType;
import com.capsule.genesis.core.graph.GraphEdge;
import com.capsule.genesis.core.graph.GraphNode;
import com.capsule.genesis.core.graph.GraphSnapshot;
import com.capsule.genesis.core.graph.NodeMetadata;
import com.capsule.genesis.core.logging.LogMessageKeys;
import com.capsule.genesis.core.patterns.ApplyPattern;
import com.capsule.genesis.core.patterns.BindPattern;
import com.capsule.genesis.core.patterns.ConstructorPattern;
import com.capsule.genesis.core.patterns.LambdaPattern;
import com.capsule.genesis.core.patterns.ListPattern;
import com.capsule.genesis.core.patterns.LiteralPattern;
import com.capsule.genesis.core.patterns.Pattern;
import com.capsule.genesis.core.patterns.PatternBindings;
import com.capsule.genesis.core.patterns.RecordPattern;
import com.capsule.genesis.core.patterns.TuplePattern;
import com.capsule.genesis.core.patterns.VarPattern;
import com.capsule.genesis.core.patterns.WildcardPattern;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Canonical encoding of graph values as FoundationDB {@link Tuple}s.
 *
 * <p>
 * Every value becomes a tuple whose first element is a short type tag, followed by the value's fields in a fixed
 * order. Collections whose order carries no meaning are sorted before encoding (nodes by hash, edges by
 * {@link GraphEdge#compareTo(GraphEdge) edge order}, bindings by name), so that equal values always pack to the
 * same bytes. The packed form is what content hashes are computed over.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class GenesisTupleCodec {
    // literal kinds
    private static final String INT = "int";
    private static final String FLOAT = "float";
    private static final String STRING = "str";
    private static final String BOOL = "bool";
    private static final String UNIT = "unit";

    // expression tags
    private static final String LITERAL = "Lit";
    private static final String VAR = "Var";
    private static final String LAMBDA = "Lam";
    private static final String APPLY = "App";
    private static final String LINEAR_APPLY = "LApp";
    private static final String LET = "Let";
    private static final String MATCH = "Match";
    private static final String TUPLE = "Tup";
    private static final String LIST = "List";
    private static final String RECORD = "Rec";

    // pattern tags
    private static final String P_WILDCARD = "P_";
    private static final String P_VAR = "PVar";
    private static final String P_LITERAL = "PLit";
    private static final String P_BIND = "PBind";
    private static final String P_TUPLE = "PTup";
    private static final String P_LIST = "PList";
    private static final String P_CONSTRUCTOR = "PCon";
    private static final String P_RECORD = "PRec";
    private static final String P_LAMBDA = "PLam";
    private static final String P_APPLY = "PApp";

    // top level tags
    private static final String NODE = "Node";
    private static final String EDGE = "Edge";
    private static final String GRAPH = "Graph";
    private static final String SNAPSHOT = "Snapshot";
    private static final String BINDINGS = "Bindings";

    private GenesisTupleCodec() {
    }

    // ---------------------------------------------------------------- literals

    @Nonnull
    public static Tuple encodeLiteral(@Nonnull Literal literal) {
        switch (literal.getKind()) {
            case INT:
                return Tuple.from(INT, literal.getIntValue());
            case FLOAT:
                return Tuple.from(FLOAT, literal.getFloatText());
            case STRING:
                return Tuple.from(STRING, literal.getStringValue());
            case BOOL:
                return Tuple.from(BOOL, literal.getBoolValue());
            case UNIT:
                return Tuple.from(UNIT);
            default:
                throw new GenesisSerializationException("unknown literal kind", LogMessageKeys.TUPLE_TAG, literal.getKind());
        }
    }

    @Nonnull
    public static Literal decodeLiteral(@Nonnull Tuple tuple) {
        String kind = tuple.getString(0);
        switch (kind) {
            case INT:
                return Literal.ofInt(tuple.getLong(1));
            case FLOAT:
                return Literal.ofFloat(tuple.getString(1));
            case STRING:
                return Literal.ofString(tuple.getString(1));
            case BOOL:
                return Literal.ofBool(tuple.getBoolean(1));
            case UNIT:
                return Literal.UNIT;
            default:
                throw new GenesisSerializationException("unknown literal kind", LogMessageKeys.TUPLE_TAG, kind);
        }
    }

    // ------------------------------------------------------------- expressions

    @Nonnull
    public static Tuple encodeExpression(@Nonnull Expression expression) {
        if (expression instanceof LiteralExpression) {
            return Tuple.from(LITERAL, encodeLiteral(((LiteralExpression)expression).getLiteral()));
        } else if (expression instanceof VarExpression) {
            return Tuple.from(VAR, ((VarExpression)expression).getName());
        } else if (expression instanceof LambdaExpression) {
            LambdaExpression lambda = (LambdaExpression)expression;
            return Tuple.from(LAMBDA, lambda.getParam(), encodeExpression(lambda.getBody()));
        } else if (expression instanceof ApplyExpression) {
            ApplyExpression apply = (ApplyExpression)expression;
            return Tuple.from(APPLY, encodeExpression(apply.getFunction()), encodeExpression(apply.getArgument()));
        } else if (expression instanceof LinearApplyExpression) {
            LinearApplyExpression apply = (LinearApplyExpression)expression;
            return Tuple.from(LINEAR_APPLY, encodeExpression(apply.getFunction()), encodeExpression(apply.getArgument()));
        } else if (expression instanceof LetExpression) {
            LetExpression let = (LetExpression)expression;
            return Tuple.from(LET, let.getName(), encodeExpression(let.getValue()), encodeExpression(let.getBody()));
        } else if (expression instanceof MatchExpression) {
            MatchExpression match = (MatchExpression)expression;
            List<Tuple> arms = new ArrayList<>();
            for (MatchArm arm : match.getArms()) {
                arms.add(Tuple.from(encodePattern(arm.getPattern()),
                        arm.getGuard().map(GenesisTupleCodec::encodeExpression).orElse(null),
                        encodeExpression(arm.getBody())));
            }
            return Tuple.from(MATCH, encodeExpression(match.getScrutinee()), Tuple.fromList(arms));
        } else if (expression instanceof TupleExpression) {
            return Tuple.from(TUPLE, encodeExpressions(((TupleExpression)expression).getElements()));
        } else if (expression instanceof ListExpression) {
            return Tuple.from(LIST, encodeExpressions(((ListExpression)expression).getElements()));
        } else if (expression instanceof RecordExpression) {
            List<Tuple> fields = new ArrayList<>();
            for (Map.Entry<String, Expression> field : ((RecordExpression)expression).getFields()) {
                fields.add(Tuple.from(field.getKey(), encodeExpression(field.getValue())));
            }
            return Tuple.from(RECORD, Tuple.fromList(fields));
        }
        throw new GenesisSerializationException("unknown expression kind",
                LogMessageKeys.TUPLE_TAG, expression.getClass().getSimpleName());
    }

    @Nonnull
    private static Tuple encodeExpressions(@Nonnull List<Expression> expressions) {
        List<Tuple> encoded = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            encoded.add(encodeExpression(expression));
        }
        return Tuple.fromList(encoded);
    }

    @Nonnull
    public static Expression decodeExpression(@Nonnull Tuple tuple) {
        String tag = tuple.getString(0);
        switch (tag) {
            case LITERAL:
                return new LiteralExpression(decodeLiteral(tuple.getNestedTuple(1)));
            case VAR:
                return new VarExpression(tuple.getString(1));
            case LAMBDA:
                return new LambdaExpression(tuple.getString(1), decodeExpression(tuple.getNestedTuple(2)));
            case APPLY:
                return new ApplyExpression(decodeExpression(tuple.getNestedTuple(1)), decodeExpression(tuple.getNestedTuple(2)));
            case LINEAR_APPLY:
                return new LinearApplyExpression(decodeExpression(tuple.getNestedTuple(1)), decodeExpression(tuple.getNestedTuple(2)));
            case LET:
                return new LetExpression(tuple.getString(1), decodeExpression(tuple.getNestedTuple(2)),
                        decodeExpression(tuple.getNestedTuple(3)));
            case MATCH:
                ImmutableList.Builder<MatchArm> arms = ImmutableList.builder();
                Tuple encodedArms = tuple.getNestedTuple(2);
                for (int i = 0; i < encodedArms.size(); i++) {
                    Tuple arm = encodedArms.getNestedTuple(i);
                    Tuple guard = arm.getNestedTuple(1);
                    arms.add(new MatchArm(decodePattern(arm.getNestedTuple(0)),
                            guard == null ? null : decodeExpression(guard),
                            decodeExpression(arm.getNestedTuple(2))));
                }
                return new MatchExpression(decodeExpression(tuple.getNestedTuple(1)), arms.build());
            case TUPLE:
                return new TupleExpression(decodeExpressions(tuple.getNestedTuple(1)));
            case LIST:
                return new ListExpression(decodeExpressions(tuple.getNestedTuple(1)));
            case RECORD:
                ImmutableList.Builder<Map.Entry<String, Expression>> fields = ImmutableList.builder();
                Tuple encodedFields = tuple.getNestedTuple(1);
                for (int i = 0; i < encodedFields.size(); i++) {
                    Tuple field = encodedFields.getNestedTuple(i);
                    fields.add(Maps.immutableEntry(field.getString(0), decodeExpression(field.getNestedTuple(1))));
                }
                return new RecordExpression(fields.build());
            default:
                throw new GenesisSerializationException("unknown expression tag", LogMessageKeys.TUPLE_TAG, tag);
        }
    }

    @Nonnull
    private static List<Expression> decodeExpressions(@Nonnull Tuple tuple) {
        ImmutableList.Builder<Expression> builder = ImmutableList.builder();
        for (int i = 0; i < tuple.size(); i++) {
            builder.add(decodeExpression(tuple.getNestedTuple(i)));
        }
        return builder.build();
    }

    // ---------------------------------------------------------------- patterns

    @Nonnull
    public static Tuple encodePattern(@Nonnull Pattern pattern) {
        if (pattern instanceof WildcardPattern) {
            return Tuple.from(P_WILDCARD);
        } else if (pattern instanceof VarPattern) {
            return Tuple.from(P_VAR, ((VarPattern)pattern).getName());
        } else if (pattern instanceof LiteralPattern) {
            return Tuple.from(P_LITERAL, encodeLiteral(((LiteralPattern)pattern).getLiteral()));
        } else if (pattern instanceof BindPattern) {
            BindPattern bind = (BindPattern)pattern;
            return Tuple.from(P_BIND, bind.getName(), encodePattern(bind.getPattern()));
        } else if (pattern instanceof TuplePattern) {
            return Tuple.from(P_TUPLE, encodePatterns(((TuplePattern)pattern).getElements()));
        } else if (pattern instanceof ListPattern) {
            return Tuple.from(P_LIST, encodePatterns(((ListPattern)pattern).getElements()));
        } else if (pattern instanceof ConstructorPattern) {
            ConstructorPattern constructor = (ConstructorPattern)pattern;
            return Tuple.from(P_CONSTRUCTOR, constructor.getName(), encodePatterns(constructor.getArguments()));
        } else if (pattern instanceof RecordPattern) {
            List<Tuple> fields = new ArrayList<>();
            for (Map.Entry<String, Pattern> field : ((RecordPattern)pattern).getFields()) {
                fields.add(Tuple.from(field.getKey(), encodePattern(field.getValue())));
            }
            return Tuple.from(P_RECORD, Tuple.fromList(fields));
        } else if (pattern instanceof LambdaPattern) {
            LambdaPattern lambda = (LambdaPattern)pattern;
            return Tuple.from(P_LAMBDA, encodePattern(lambda.getParamPattern()), encodePattern(lambda.getBodyPattern()));
        } else if (pattern instanceof ApplyPattern) {
            ApplyPattern apply = (ApplyPattern)pattern;
            return Tuple.from(P_APPLY, encodePattern(apply.getFunctionPattern()), encodePattern(apply.getArgumentPattern()));
        }
        throw new GenesisSerializationException("unknown pattern kind",
                LogMessageKeys.TUPLE_TAG, pattern.getClass().getSimpleName());
    }

    @Nonnull
    private static Tuple encodePatterns(@Nonnull List<Pattern> patterns) {
        List<Tuple> encoded = new ArrayList<>(patterns.size());
        for (Pattern pattern : patterns) {
            encoded.add(encodePattern(pattern));
        }
        return Tuple.fromList(encoded);
    }

    @Nonnull
    public static Pattern decodePattern(@Nonnull Tuple tuple) {
        String tag = tuple.getString(0);
        switch (tag) {
            case P_WILDCARD:
                return WildcardPattern.INSTANCE;
            case P_VAR:
                return new VarPattern(tuple.getString(1));
            case P_LITERAL:
                return new LiteralPattern(decodeLiteral(tuple.getNestedTuple(1)));
            case P_BIND:
                return new BindPattern(tuple.getString(1), decodePattern(tuple.getNestedTuple(2)));
            case P_TUPLE:
                return new TuplePattern(decodePatterns(tuple.getNestedTuple(1)));
            case P_LIST:
                return new ListPattern(decodePatterns(tuple.getNestedTuple(1)));
            case P_CONSTRUCTOR:
                return new ConstructorPattern(tuple.getString(1), decodePatterns(tuple.getNestedTuple(2)));
            case P_RECORD:
                ImmutableList.Builder<Map.Entry<String, Pattern>> fields = ImmutableList.builder();
                Tuple encodedFields = tuple.getNestedTuple(1);
                for (int i = 0; i < encodedFields.size(); i++) {
                    Tuple field = encodedFields.getNestedTuple(i);
                    fields.add(Maps.immutableEntry(field.getString(0), decodePattern(field.getNestedTuple(1))));
                }
                return new RecordPattern(fields.build());
            case P_LAMBDA:
                return new LambdaPattern(decodePattern(tuple.getNestedTuple(1)), decodePattern(tuple.getNestedTuple(2)));
            case P_APPLY:
                return new ApplyPattern(decodePattern(tuple.getNestedTuple(1)), decodePattern(tuple.getNestedTuple(2)));
            default:
                throw new GenesisSerializationException("unknown pattern tag", LogMessageKeys.TUPLE_TAG, tag);
        }
    }

    @Nonnull
    private static List<Pattern> decodePatterns(@Nonnull Tuple tuple) {
        ImmutableList.Builder<Pattern> builder = ImmutableList.builder();
        for (int i = 0; i < tuple.size(); i++) {
            builder.add(decodePattern(tuple.getNestedTuple(i)));
        }
        return builder.build();
    }

    // ------------------------------------------------------------ graph values

    @Nonnull
    public static Tuple encodeNode(@Nonnull GraphNode node) {
        NodeMetadata metadata = node.getMetadata();
        return Tuple.from(NODE, node.getId(), node.getRootRef(), encodeExpression(node.getData()),
                Tuple.from(metadata.getTimestamp(), (long)metadata.getLineageDepth(), Tuple.fromList(metadata.getTags())));
    }

    @Nonnull
    public static GraphNode decodeNode(@Nonnull Tuple tuple) {
        checkTag(tuple, NODE);
        Tuple metadata = tuple.getNestedTuple(4);
        List<String> tags = new ArrayList<>();
        Tuple encodedTags = metadata.getNestedTuple(2);
        for (int i = 0; i < encodedTags.size(); i++) {
            tags.add(encodedTags.getString(i));
        }
        return new GraphNode(tuple.getString(1), tuple.getString(2), decodeExpression(tuple.getNestedTuple(3)),
                new NodeMetadata(metadata.getLong(0), Math.toIntExact(metadata.getLong(1)), tags));
    }

    @Nonnull
    public static Tuple encodeEdge(@Nonnull GraphEdge edge) {
        return Tuple.from(EDGE, edge.getFrom(), edge.getTo(), edge.getEdgeType().name());
    }

    @Nonnull
    public static GraphEdge decodeEdge(@Nonnull Tuple tuple) {
        checkTag(tuple, EDGE);
        return new GraphEdge(tuple.getString(1), tuple.getString(2), EdgeType.valueOf(tuple.getString(3)));
    }

    /**
     * Encode a whole graph state: the root hash, the nodes sorted by hash, and the edges in canonical order.
     * Neither the iteration order of {@code nodes} nor the order of {@code edges} affects the result.
     *
     * @param rootHash the root hash
     * @param nodes nodes by hash
     * @param edges the edges
     * @return the canonical tuple
     */
    @Nonnull
    public static Tuple encodeGraph(@Nonnull String rootHash, @Nonnull Map<String, GraphNode> nodes,
                                    @Nonnull List<GraphEdge> edges) {
        SortedMap<String, GraphNode> sortedNodes = new TreeMap<>(nodes);
        List<Tuple> encodedNodes = new ArrayList<>(sortedNodes.size());
        for (Map.Entry<String, GraphNode> entry : sortedNodes.entrySet()) {
            encodedNodes.add(Tuple.from(entry.getKey(), encodeNode(entry.getValue())));
        }
        List<GraphEdge> sortedEdges = new ArrayList<>(edges);
        sortedEdges.sort(null);
        List<Tuple> encodedEdges = new ArrayList<>(sortedEdges.size());
        for (GraphEdge edge : sortedEdges) {
            encodedEdges.add(encodeEdge(edge));
        }
        return Tuple.from(GRAPH, rootHash, Tuple.fromList(encodedNodes), Tuple.fromList(encodedEdges));
    }

    @Nonnull
    public static Tuple encodeSnapshot(@Nonnull GraphSnapshot snapshot) {
        return Tuple.from(SNAPSHOT,
                encodeGraph(snapshot.getRootHash(), snapshot.getNodes(), snapshot.getEdges()),
                snapshot.getContentHash());
    }

    @Nonnull
    public static GraphSnapshot decodeSnapshot(@Nonnull Tuple tuple) {
        checkTag(tuple, SNAPSHOT);
        Tuple graph = tuple.getNestedTuple(1);
        checkTag(graph, GRAPH);
        Map<String, GraphNode> nodes = new TreeMap<>();
        Tuple encodedNodes = graph.getNestedTuple(2);
        for (int i = 0; i < encodedNodes.size(); i++) {
            Tuple entry = encodedNodes.getNestedTuple(i);
            nodes.put(entry.getString(0), decodeNode(entry.getNestedTuple(1)));
        }
        List<GraphEdge> edges = new ArrayList<>();
        Tuple encodedEdges = graph.getNestedTuple(3);
        for (int i = 0; i < encodedEdges.size(); i++) {
            edges.add(decodeEdge(encodedEdges.getNestedTuple(i)));
        }
        return new GraphSnapshot(graph.getString(1), nodes, edges, tuple.getString(2));
    }

    @Nonnull
    public static Tuple encodeBindings(@Nonnull PatternBindings bindings) {
        List<Tuple> entries = new ArrayList<>(bindings.size());
        for (Map.Entry<String, Expression> entry : bindings.asMap().entrySet()) {
            entries.add(Tuple.from(entry.getKey(), encodeExpression(entry.getValue())));
        }
        return Tuple.from(BINDINGS, Tuple.fromList(entries));
    }

    @Nonnull
    public static PatternBindings decodeBindings(@Nonnull Tuple tuple) {
        checkTag(tuple, BINDINGS);
        PatternBindings.Builder builder = PatternBindings.newBuilder();
        Tuple entries = tuple.getNestedTuple(1);
        for (int i = 0; i < entries.size(); i++) {
            Tuple entry = entries.getNestedTuple(i);
            builder.set(entry.getString(0), decodeExpression(entry.getNestedTuple(1)));
        }
        return builder.build();
    }

    // ------------------------------------------------------------------- bytes

    @Nonnull
    public static byte[] toBytes(@Nonnull Tuple tuple) {
        return tuple.pack();
    }

    @Nonnull
    public static byte[] expressionToBytes(@Nonnull Expression expression) {
        return encodeExpression(expression).pack();
    }

    @Nonnull
    public static Expression expressionFromBytes(@Nonnull byte[] bytes) {
        return decode(bytes, GenesisTupleCodec::decodeExpression);
    }

    @Nonnull
    public static byte[] patternToBytes(@Nonnull Pattern pattern) {
        return encodePattern(pattern).pack();
    }

    @Nonnull
    public static Pattern patternFromBytes(@Nonnull byte[] bytes) {
        return decode(bytes, GenesisTupleCodec::decodePattern);
    }

    @Nonnull
    public static byte[] nodeToBytes(@Nonnull GraphNode node) {
        return encodeNode(node).pack();
    }

    @Nonnull
    public static GraphNode nodeFromBytes(@Nonnull byte[] bytes) {
        return decode(bytes, GenesisTupleCodec::decodeNode);
    }

    @Nonnull
    public static byte[] edgeToBytes(@Nonnull GraphEdge edge) {
        return encodeEdge(edge).pack();
    }

    @Nonnull
    public static GraphEdge edgeFromBytes(@Nonnull byte[] bytes) {
        return decode(bytes, GenesisTupleCodec::decodeEdge);
    }

    @Nonnull
    public static byte[] bindingsToBytes(@Nonnull PatternBindings bindings) {
        return encodeBindings(bindings).pack();
    }

    @Nonnull
    public static PatternBindings bindingsFromBytes(@Nonnull byte[] bytes) {
        return decode(bytes, GenesisTupleCodec::decodeBindings);
    }

    @Nonnull
    public static GraphSnapshot snapshotFromBytes(@Nonnull byte[] bytes) {
        return decode(bytes, GenesisTupleCodec::decodeSnapshot);
    }

    /**
     * Unpack bytes and decode the resulting tuple. Any failure along the way, whether malformed tuple bytes, a
     * missing element, an element of the wrong type or an unknown tag, surfaces as a
     * {@link GenesisSerializationException}.
     */
    @Nonnull
    private static <T> T decode(@Nonnull byte[] bytes, @Nonnull Function<Tuple, T> decoder) {
        try {
            return decoder.apply(Tuple.fromBytes(bytes));
        } catch (GenesisSerializationException e) {
            throw e;
        } catch (RuntimeException e) {
            GenesisSerializationException wrapped = new GenesisSerializationException("unable to decode bytes", e);
            wrapped.addLogInfo(LogMessageKeys.RAW_BYTES, ByteArrayUtil.printable(bytes));
            throw wrapped;
        }
    }

    private static void checkTag(@Nonnull Tuple tuple, @Nonnull String expected) {
        String actual = tuple.getString(0);
        if (!expected.equals(actual)) {
            throw new GenesisSerializationException("unexpected tuple tag",
                    LogMessageKeys.EXPECTED, expected, LogMessageKeys.ACTUAL, actual);
        }
    }
}
