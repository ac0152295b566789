package com.pathfinder.prereq.graph;

import com.pathfinder.prereq.domain.DomainModels;
import com.pathfinder.prereq.domain.DomainModels.Course;
import com.pathfinder.prereq.domain.DomainModels.PrereqClause;
import com.pathfinder.prereq.domain.DomainModels.PrereqExpression;
import com.pathfinder.prereq.domain.DomainModels.PrereqItem;
import com.pathfinder.prereq.domain.DomainModels.StoredRelationship;
import com.pathfinder.prereq.graph.GraphModels.*;
import com.pathfinder.prereq.repository.PrerequisiteStore;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-only trees over stored relationships. Both walks are depth-first and share one visited set
 * per call, so a course reached a second time appears as a leaf instead of being expanded again.
 */
@Service
public class PrerequisiteGraphService {
    private final PrerequisiteStore store;

    public PrerequisiteGraphService(PrerequisiteStore store) {
        this.store = store;
    }

    public List<GroupView> prereqGroups(String course) {
        List<PrereqClause> clauses = DomainModels.toExpression(store.findByCourse(course)).clauses();
        List<GroupView> groups = new ArrayList<>();
        for (int i = 0; i < clauses.size(); i++) {
            groups.add(new GroupView(i + 1, clauses.get(i).type(), clauses.get(i).items()));
        }
        return groups;
    }

    /** What the root requires. The root sits at depth 0; nodes at {@code maxDepth} are leaves. */
    public TreeNode backwardTree(String root, int maxDepth) {
        return expandBackward(root, 0, null, maxDepth, new Traversal());
    }

    /** What the root unlocks. The root sits at depth 1 and is never its own descendant. */
    public TreeNode forwardTree(String root, int maxDepth) {
        Set<String> visited = new HashSet<>();
        visited.add(root);
        return expandForward(root, 1, maxDepth, visited);
    }

    public Optional<CourseTree> courseTree(String code, int prereqDepth, int futureDepth) {
        if (!store.exists(code)) return Optional.empty();
        Course course = store.findCourse(code).orElse(Course.placeholder(code));
        return Optional.of(new CourseTree(course, backwardTree(code, prereqDepth), forwardTree(code, futureDepth)));
    }

    private TreeNode expandBackward(String code, int depth, Integer minGrade, int maxDepth, Traversal traversal) {
        if (depth >= maxDepth || !traversal.visited().add(code)) {
            return TreeNode.leaf(code, PrereqExpression.empty(), minGrade);
        }
        PrereqExpression expression = DomainModels.toExpression(traversal.rowsFor(code, store));
        if (depth + 1 < maxDepth) {
            traversal.prefetch(expression, store);
        }

        List<TreeNode> children = new ArrayList<>();
        for (PrereqClause clause : expression.clauses()) {
            for (PrereqItem item : clause.items()) {
                children.add(expandBackward(item.code(), depth + 1, item.minGrade(), maxDepth, traversal));
            }
        }
        return new TreeNode(code, expression, minGrade, children);
    }

    private TreeNode expandForward(String code, int depth, int maxDepth, Set<String> visited) {
        if (depth > maxDepth) {
            return TreeNode.leaf(code, null, null);
        }
        List<TreeNode> children = new ArrayList<>();
        for (String next : store.findDependents(code).stream().sorted().toList()) {
            if (visited.add(next)) {
                children.add(expandForward(next, depth + 1, maxDepth, visited));
            }
        }
        return new TreeNode(code, null, null, children);
    }

    /** Visited codes and rows already loaded during one backward walk. */
    private record Traversal(Set<String> visited, Map<String, List<StoredRelationship>> rows) {
        Traversal() {
            this(new HashSet<>(), new HashMap<>());
        }

        List<StoredRelationship> rowsFor(String code, PrerequisiteStore store) {
            return rows.computeIfAbsent(code, store::findByCourse);
        }

        /** Loads the rows of all children that will be expanded next with one bulk lookup. */
        void prefetch(PrereqExpression expression, PrerequisiteStore store) {
            Set<String> pending = expression.clauses().stream()
                    .flatMap(c -> c.codes().stream())
                    .filter(c -> !visited.contains(c) && !rows.containsKey(c))
                    .collect(Collectors.toCollection(TreeSet::new));
            if (pending.isEmpty()) return;
            Map<String, List<StoredRelationship>> loaded = store.findByCourses(pending).stream()
                    .collect(Collectors.groupingBy(StoredRelationship::course));
            pending.forEach(c -> rows.put(c, loaded.getOrDefault(c, List.of())));
        }
    }
}
