package com.pathfinder.prereq.graph;

import com.pathfinder.prereq.domain.DomainModels.ClauseType;
import com.pathfinder.prereq.domain.DomainModels.Course;
import com.pathfinder.prereq.domain.DomainModels.PrereqExpression;
import com.pathfinder.prereq.domain.DomainModels.PrereqItem;

import java.util.List;

public class GraphModels {
    /**
     * @param expression prerequisite clauses of this course; null in dependent trees
     * @param minGrade   grade required on the edge that reached this node, null for the root
     */
    public record TreeNode(String code, PrereqExpression expression, Integer minGrade, List<TreeNode> children) {
        public static TreeNode leaf(String code, PrereqExpression expression, Integer minGrade) {
            return new TreeNode(code, expression, minGrade, List.of());
        }
    }

    public record GroupView(int group, ClauseType type, List<PrereqItem> courses) {}

    public record CourseTree(Course course, TreeNode prereqTree, TreeNode futureTree) {}
}
