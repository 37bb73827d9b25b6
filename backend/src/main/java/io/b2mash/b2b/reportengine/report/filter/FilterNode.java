package io.b2mash.b2b.reportengine.report.filter;

/**
 * A node of a report filter tree: either a leaf {@link FilterCondition} or a nested {@link
 * FilterGroup}. The kind is fixed when {@link FilterTreeParser} builds the node.
 */
public sealed interface FilterNode permits FilterCondition, FilterGroup {}
