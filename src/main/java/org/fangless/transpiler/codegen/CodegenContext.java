package org.fangless.transpiler.codegen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Mutable state shared by the generators during one {@link CodeGenerator#generate} call:
 * the scope tracker, the counter for unique temporary names, the enclosing loops and the function nesting depth.
 */
public final class CodegenContext {

    /**
     * One enclosing loop.
     *
     * @param completionFlag The name of the flag a {@code break} must clear, or {@code null} if the loop has no {@code else}.
     */
    public record LoopFrame(String completionFlag) {}

    private final ScopeManager scope;
    private final CodegenOptions options;
    private final Deque<LoopFrame> loops = new ArrayDeque<>();
    private int nextId = 0;
    private int functionDepth = 0;

    /**
     * Creates a context around the given scope tracker.
     * @param scope The scope tracker shared by all generators.
     * @param options The code generation options.
     */
    public CodegenContext(ScopeManager scope, CodegenOptions options) {
        this.scope = scope;
        this.options = options;
    }

    public ScopeManager scope() {
        return scope;
    }

    public CodegenOptions options() {
        return options;
    }

    /**
     * Resets all state for a new module.
     */
    public void reset() {
        scope.reset();
        loops.clear();
        nextId = 0;
        functionDepth = 0;
    }

    /**
     * @return A number not yet used for a temporary name in the current module.
     */
    public int nextId() {
        return nextId++;
    }

    public void enterLoop(LoopFrame frame) {
        loops.push(frame);
    }

    public void exitLoop() {
        loops.pop();
    }

    public boolean isInsideLoop() {
        return !loops.isEmpty();
    }

    /**
     * @return The innermost loop, or {@code null} outside of loops.
     */
    public LoopFrame innermostLoop() {
        return loops.peek();
    }

    public void enterFunction() {
        functionDepth++;
    }

    public void exitFunction() {
        functionDepth--;
    }

    public boolean isInsideFunction() {
        return functionDepth > 0;
    }

    /**
     * Indents every line by one level. Lines holding several physical lines are split first.
     * @param lines The lines to indent.
     * @return The indented lines, one physical line per entry.
     */
    public List<String> indent(List<String> lines) {
        List<String> result = new ArrayList<>();
        for (String line : lines) {
            for (String physical : line.split("\n", -1)) {
                result.add(physical.isEmpty() ? physical : options.indent() + physical);
            }
        }
        return result;
    }
}
