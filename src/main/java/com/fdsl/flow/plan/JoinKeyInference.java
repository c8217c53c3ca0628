package com.fdsl.flow.plan;

import com.fdsl.flow.expr.ExprAst;
import com.fdsl.flow.expr.References;
import com.fdsl.flow.graph.EntityNode;
import com.fdsl.flow.graph.ModelBuildException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Best-effort static inference of the field that links a secondary parent to
 * the first-resolved one.
 *
 * <p>
 * Tried in order, each rule either settles the key or falls through:
 * <ol>
 * <li>an attribute named {@code {parent}Id} or {@code {parent}_id}, ignoring
 * case;</li>
 * <li>an {@code ==} comparison in the dependent's expressions between a field
 * of the parent (or a lambda item drawn from it) and an attribute;</li>
 * <li>the declared primary key, else an attribute named {@code id}.</li>
 * </ol>
 * A rule that finds more than one candidate fails with
 * {@link ModelBuildException.Reason#AMBIGUOUS_PARENT_KEY}; nothing is guessed.
 */
public final class JoinKeyInference {

    private JoinKeyInference() {
    }

    /**
     * @param parentName        the parent that needs a lookup key
     * @param siblingAttributes attributes of the first-resolved parent, the
     *                          candidates for the key
     * @param expressions       attribute expressions of the dependent entity
     * @return the key field, or empty when no rule applies
     */
    public static Optional<String> inferJoinKey(String parentName, List<EntityNode.Attribute> siblingAttributes,
            List<ExprAst> expressions) {
        List<String> names = siblingAttributes.stream().map(EntityNode.Attribute::name).toList();

        // 1. Naming convention
        List<String> byName = new ArrayList<>();
        for (String n : names)
            if (n.equalsIgnoreCase(parentName + "Id") || n.equalsIgnoreCase(parentName + "_id"))
                byName.add(n);
        Optional<String> key = single(parentName, byName, "naming convention");
        if (key.isPresent())
            return key;

        // 2. Equality comparisons
        Set<String> byReference = new LinkedHashSet<>();
        for (ExprAst expr : expressions) {
            for (References.Equality eq : References.equalities(expr)) {
                collect(eq.left(), eq.right(), parentName, names, byReference);
                collect(eq.right(), eq.left(), parentName, names, byReference);
            }
        }
        key = single(parentName, new ArrayList<>(byReference), "expression references");
        if (key.isPresent())
            return key;

        // 3. Identifier fallback
        List<String> primary = siblingAttributes.stream().filter(EntityNode.Attribute::primaryKey)
                .map(EntityNode.Attribute::name).toList();
        key = single(parentName, primary, "primary key");
        if (key.isPresent())
            return key;
        return names.contains("id") ? Optional.of("id") : Optional.empty();
    }

    private static void collect(References.FieldRef candidate, References.FieldRef other, String parentName,
            List<String> names, Set<String> out) {
        if (candidate.local() || candidate.entity().equals(parentName))
            return;
        if ((other.local() || other.entity().equals(parentName)) && names.contains(candidate.field()))
            out.add(candidate.field());
    }

    private static Optional<String> single(String parentName, List<String> candidates, String rule) {
        if (candidates.size() > 1) {
            List<String> subjects = new ArrayList<>();
            subjects.add(parentName);
            subjects.addAll(candidates);
            throw new ModelBuildException(ModelBuildException.Reason.AMBIGUOUS_PARENT_KEY, subjects,
                    "more than one join key for " + parentName + " by " + rule + ": " + candidates);
        }
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }
}
