package org.puneet.searchspace.core;

import org.apache.commons.math3.random.RandomGenerator;
import org.puneet.searchspace.constraint.ParameterConstraint;
import org.puneet.searchspace.exceptions.SearchSpaceOperationException;
import org.puneet.searchspace.exceptions.ValidationException;
import org.puneet.searchspace.exceptions.ValidationException.ValidationType;
import org.puneet.searchspace.parameter.Parameter;
import org.puneet.searchspace.util.SearchSpaceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Search space whose parameters form a dependency tree: a choice or fixed parameter
 * may declare, per value, which parameters become applicable when it takes that value.
 *
 * <p>Construction finds the single root (the only parameter no other parameter lists
 * as a dependent) and proves that the dependency relation is a tree: subtrees are
 * pairwise disjoint and every parameter is reachable from the root. The structure is
 * fixed for the lifetime of the space.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class HierarchicalSearchSpace extends SearchSpace {

    private static final Logger logger = LoggerFactory.getLogger(HierarchicalSearchSpace.class);

    private final String rootName;
    private final RandomGenerator dummyValueGenerator;

    public HierarchicalSearchSpace(List<? extends Parameter> parameters) throws ValidationException {
        this(parameters, null);
    }

    /**
     * Creates a hierarchical search space and validates its tree structure.
     *
     * @param parameters the parameters, with unique names
     * @param parameterConstraints constraints over the parameters, may be null
     * @throws ValidationException if the definition is invalid, no single root exists,
     *         subtrees overlap, or parameters are unreachable from the root
     */
    public HierarchicalSearchSpace(List<? extends Parameter> parameters,
                                   List<? extends ParameterConstraint> parameterConstraints)
            throws ValidationException {
        super(parameters, parameterConstraints);
        this.rootName = findRoot().getName();
        validateHierarchicalStructure();
        this.dummyValueGenerator = SearchSpaceConfig.newRandomGenerator();
        logger.info("Created hierarchical search space with root '{}', {} parameters and height {}",
                rootName, getParameters().size(), height());
    }

    @Override
    public boolean isHierarchical() {
        return true;
    }

    /**
     * The root parameter, as currently owned by this space.
     *
     * @return the root parameter instance
     */
    public Parameter getRoot() {
        return getParameters().get(rootName);
    }

    /**
     * Length of the longest dependency chain starting at the root. A space without
     * hierarchical parameters has height 1.
     *
     * @return the tree height
     */
    public int height() {
        return heightFrom(getRoot());
    }

    private int heightFrom(Parameter parameter) {
        int tallest = 0;
        for (List<String> dependents : parameter.getDependents().values()) {
            for (String dependent : dependents) {
                tallest = Math.max(tallest, heightFrom(getParameters().get(dependent)));
            }
        }
        return tallest + 1;
    }

    /**
     * Ordinary search space over the same parameters and constraints, ignoring the
     * dependency structure.
     *
     * @return the flat view
     * @throws ValidationException if the flat space cannot be constructed
     */
    public SearchSpace flatten() throws ValidationException {
        return new SearchSpace(new ArrayList<>(getParameters().values()), getParameterConstraints());
    }

    /**
     * Adding parameters would change the dependency structure, which is fixed at
     * construction.
     *
     * @param parameter the rejected parameter
     * @throws ValidationException always
     */
    @Override
    public void addParameter(Parameter parameter) throws ValidationException {
        throw ValidationException.structureViolation(String.format(
                "Cannot add parameter `%s`: the dependency structure of a %s is fixed at construction.",
                parameter.getName(), getClass().getSimpleName()));
    }

    /**
     * Replaces the definition of an existing parameter without touching the tree: the
     * new definition must declare the same dependents as the previous one.
     *
     * @param parameter the new definition
     * @throws ValidationException if no parameter with that name exists
     * @throws SearchSpaceOperationException if the value type or the dependents would change
     */
    @Override
    public void updateParameter(Parameter parameter)
            throws ValidationException, SearchSpaceOperationException {
        Parameter previous = getParameter(parameter.getName());
        if (!previous.getDependents().equals(parameter.getDependents())) {
            throw SearchSpaceOperationException.unsupportedOperation(
                    getClass().getSimpleName(), "updateParameter with different dependents");
        }
        super.updateParameter(parameter);
    }

    /**
     * Casts the arm's values to the declared types, then restricts it to the
     * parameters applicable under its own values.
     *
     * @param arm the arm to cast
     * @return a new arm with the same name
     * @throws ValidationException if an applicable parameter is missing or has a value
     *         of the wrong type
     */
    @Override
    public Arm castArm(Arm arm) throws ValidationException {
        Arm flat = super.castArm(arm);
        return new Arm(castParameterization(flat.getParameters(), true),
                flat.hasName() ? flat.getName() : null);
    }

    /**
     * Membership additionally requires that the parameterization holds exactly the
     * parameters applicable under its own values.
     */
    @Override
    public boolean checkMembership(Map<String, ?> parameterization, boolean raiseError,
                                   boolean checkAllParametersPresent) throws ValidationException {
        if (!super.checkMembership(parameterization, raiseError, false)) {
            return false;
        }

        Set<String> applicable;
        try {
            applicable = castParameterization(parameterization, checkAllParametersPresent).keySet();
        } catch (ValidationException e) {
            if (raiseError) {
                throw e;
            }
            return false;
        }
        if (!applicable.equals(parameterization.keySet())) {
            if (raiseError) {
                throw ValidationException.hierarchyViolation(ValidationType.HIERARCHY_VALIDATION,
                        String.format("Cast version would have parameters: %s, but full version "
                                + "contains parameters: %s.", applicable, parameterization.keySet()),
                        parameterization, structureForErrors());
            }
            return false;
        }
        return true;
    }

    /**
     * Parameters absent from a hierarchical parameterization may be inapplicable, so
     * strict validation only checks the ones present.
     */
    @Override
    protected boolean isValueRequired(String parameterName, Map<String, ?> parameterization) {
        return parameterization.containsKey(parameterName);
    }

    /**
     * Restricts a parameterization to the parameters applicable under its own values.
     * The root is always applicable; a dependent is applicable when its parent is
     * applicable and takes a value whose dependents list it.
     *
     * @param parameterization the parameterization to cast
     * @param checkAllParametersPresent whether a missing applicable parameter is an
     *        error; otherwise its subtree is skipped
     * @return the applicable entries, in the input order
     * @throws ValidationException if an applicable parameter is missing while required,
     *         or a hierarchical parameter holds a value of the wrong type
     */
    public Map<String, Object> castParameterization(Map<String, ?> parameterization,
                                                    boolean checkAllParametersPresent)
            throws ValidationException {
        Set<String> applicable = new HashSet<>();
        Set<String> missing = new LinkedHashSet<>();
        Deque<Parameter> pending = new ArrayDeque<>();
        pending.push(getRoot());

        while (!pending.isEmpty()) {
            Parameter parameter = pending.pop();
            applicable.add(parameter.getName());
            if (!parameterization.containsKey(parameter.getName())) {
                if (checkAllParametersPresent) {
                    missing.add(parameter.getName());
                }
                continue;
            }
            if (!parameter.isHierarchical()) {
                continue;
            }
            Object value = parameterization.get(parameter.getName());
            if (value == null) {
                continue;
            }
            if (!parameter.isValidType(value)) {
                throw ValidationException.hierarchyViolation(ValidationType.TYPE_VALIDATION,
                        String.format("Value %s of parameter '%s' is of type %s, expected %s.",
                                value, parameter.getName(), value.getClass().getSimpleName(),
                                parameter.getJavaType().getSimpleName()),
                        parameterization, structureForErrors());
            }
            Object cast = parameter.cast(value);
            for (Map.Entry<Object, List<String>> branch : parameter.getDependents().entrySet()) {
                if (Objects.equals(cast, branch.getKey())) {
                    for (String dependent : branch.getValue()) {
                        pending.push(getParameters().get(dependent));
                    }
                }
            }
        }

        if (!missing.isEmpty()) {
            throw ValidationException.hierarchyViolation(ValidationType.HIERARCHY_VALIDATION,
                    String.format("Parameters %s are missing.", missing),
                    parameterization, structureForErrors());
        }

        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : parameterization.entrySet()) {
            if (applicable.contains(entry.getKey())) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /**
     * Casts observation features to the hierarchical structure without requiring all
     * applicable parameters, recording the original parameterization on the result.
     *
     * @param features the features to cast
     * @return new features holding the applicable parameters and the full parameterization
     * @throws ValidationException if a hierarchical parameter holds a value of the wrong type
     */
    public ObservationFeatures castObservationFeatures(ObservationFeatures features)
            throws ValidationException {
        Map<String, Object> cast = castParameterization(features.getParameters(), false);
        return features.withParameters(cast).withFullParameterization(features.getParameters());
    }

    /**
     * Flattens features previously cast with {@link #castObservationFeatures}, using
     * midpoint dummy values when injection is requested.
     *
     * @param features the features to flatten, updated in place
     * @param injectDummyValues whether to complete the parameterization with dummy values
     * @return the same features instance
     */
    public ObservationFeatures flattenObservationFeatures(ObservationFeatures features,
                                                          boolean injectDummyValues) {
        return flattenObservationFeatures(features, injectDummyValues, false);
    }

    /**
     * Flattens features previously cast with {@link #castObservationFeatures}. The
     * recorded full parameterization is restored underneath the current values; if the
     * result is still incomplete, dummy values fill the gaps when requested, otherwise
     * a warning is logged and the features stay incomplete.
     *
     * @param features the features to flatten, updated in place
     * @param injectDummyValues whether to complete the parameterization with dummy values
     * @param useRandomDummyValues whether dummy values are drawn at random instead of
     *        taken from the middle of each domain
     * @return the same features instance
     */
    public ObservationFeatures flattenObservationFeatures(ObservationFeatures features,
                                                          boolean injectDummyValues,
                                                          boolean useRandomDummyValues) {
        boolean hasFullParameterization = features.hasFullParameterization();
        if (features.getParameters().isEmpty() && !hasFullParameterization) {
            return features;
        }

        if (hasFullParameterization) {
            Map<String, Object> restored = new LinkedHashMap<>(features.getFullParameterization());
            restored.putAll(features.getParameters());
            features.setParameters(restored);
        }

        if (features.getParameters().size() < getParameters().size()) {
            if (injectDummyValues) {
                Map<String, Object> completed = dummyValues(features.getParameters(), useRandomDummyValues);
                completed.putAll(features.getParameters());
                features.setParameters(completed);
            } else {
                logger.warn("Cannot flatten observation features {} as full parameterization is not "
                        + "recorded and dummy value injection is disabled", features);
            }
        }
        return features;
    }

    private Map<String, Object> dummyValues(Map<String, Object> present, boolean random) {
        Map<String, Object> dummies = new LinkedHashMap<>();
        for (Parameter parameter : getParameters().values()) {
            if (present.containsKey(parameter.getName())) {
                continue;
            }
            Object value = random ? parameter.sample(dummyValueGenerator) : parameter.midpoint();
            dummies.put(parameter.getName(), value);
        }
        logger.debug("Injecting dummy values {}", dummies);
        return dummies;
    }

    /**
     * Indented rendering of the dependency tree. Each value branch is indented one
     * tab deeper than its parameter, and its dependents one tab deeper than the branch.
     *
     * @param parameterNamesOnly whether parameters are rendered by name only
     * @return the rendering, one node per line
     */
    public String hierarchicalStructureString(boolean parameterNamesOnly) {
        StringBuilder sb = new StringBuilder();
        appendStructure(sb, getRoot(), 0, parameterNamesOnly);
        return sb.toString();
    }

    public String hierarchicalStructureString() {
        return hierarchicalStructureString(false);
    }

    private void appendStructure(StringBuilder sb, Parameter parameter, int level, boolean namesOnly) {
        sb.append("\t".repeat(level))
          .append(namesOnly ? parameter.getName() : parameter.toString())
          .append('\n');
        for (Map.Entry<Object, List<String>> branch : parameter.getDependents().entrySet()) {
            sb.append("\t".repeat(level + 1)).append('(').append(branch.getKey()).append(")\n");
            for (String dependent : branch.getValue()) {
                appendStructure(sb, getParameters().get(dependent), level + 2, namesOnly);
            }
        }
    }

    private String structureForErrors() {
        return hierarchicalStructureString(SearchSpaceConfig.isNamesOnlyInErrors());
    }

    private Parameter findRoot() throws ValidationException {
        Set<String> dependentNames = new LinkedHashSet<>();
        for (Parameter parameter : getParameters().values()) {
            for (List<String> dependents : parameter.getDependents().values()) {
                for (String dependent : dependents) {
                    if (!hasParameter(dependent)) {
                        throw ValidationException.invalidDefinition(String.format(
                                "Parameter %s lists dependent `%s`, which does not exist in search space.",
                                parameter.getName(), dependent));
                    }
                    dependentNames.add(dependent);
                }
            }
        }

        Set<String> rootCandidates = new LinkedHashSet<>(getParameters().keySet());
        rootCandidates.removeAll(dependentNames);
        if (rootCandidates.size() != 1) {
            throw ValidationException.structureViolation(String.format(
                    "Could not find the root parameter; found dependent parameters %s, with %d total "
                            + "parameters. Root parameter candidates: %s. Having multiple independent "
                            + "parameters is not supported.",
                    dependentNames, getParameters().size(), rootCandidates));
        }
        Parameter found = getParameters().get(rootCandidates.iterator().next());
        logger.debug("Found root: {}", found.getName());
        return found;
    }

    private void validateHierarchicalStructure() throws ValidationException {
        Set<String> visited = checkSubtree(getRoot(), new HashSet<>());
        Set<String> unreachable = new LinkedHashSet<>(getParameters().keySet());
        unreachable.removeAll(visited);
        if (!unreachable.isEmpty()) {
            throw ValidationException.structureViolation(String.format(
                    "Parameters %s are not reachable from the root. Please check that the hierarchical "
                            + "search space is represented as a valid tree with a single root.",
                    unreachable));
        }
        logger.debug("Visited all parameters in the tree: {}", visited);
    }

    private Set<String> checkSubtree(Parameter subtreeRoot, Set<String> path) throws ValidationException {
        if (!path.add(subtreeRoot.getName())) {
            throw ValidationException.structureViolation(
                    "Dependency cycle through parameter " + subtreeRoot.getName());
        }
        Set<String> visited = new LinkedHashSet<>();
        visited.add(subtreeRoot.getName());
        for (List<String> dependents : subtreeRoot.getDependents().values()) {
            for (String dependent : dependents) {
                Set<String> subtree = checkSubtree(getParameters().get(dependent), path);
                disjointUnion(visited, subtree);
            }
        }
        path.remove(subtreeRoot.getName());
        logger.debug("Visited parameters {} in subtree of {}", visited, subtreeRoot.getName());
        return visited;
    }

    private static void disjointUnion(Set<String> target, Set<String> addition) throws ValidationException {
        Set<String> shared = new LinkedHashSet<>(target);
        shared.retainAll(addition);
        if (!shared.isEmpty()) {
            throw ValidationException.structureViolation(
                    "Two subtrees in the search space contain the same parameters: " + shared);
        }
        target.addAll(addition);
    }

    @Override
    public HierarchicalSearchSpace copy() throws ValidationException {
        return new HierarchicalSearchSpace(copyParameters(getParameters().values()), copyConstraints());
    }
}
