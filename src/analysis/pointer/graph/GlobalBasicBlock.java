package analysis.pointer.graph;

import ir.FunctionId;

import com.ibm.wala.ipa.callgraph.ContextItem;

/**
 * Basic block identified across the whole program: a function and a block index within it
 */
public final class GlobalBasicBlock implements ContextItem {

    private final FunctionId function;
    private final int block;
    private final int memoizedHashCode;

    /**
     * Create a program-wide block identifier
     *
     * @param function function containing the block
     * @param block index of the block
     */
    public GlobalBasicBlock(FunctionId function, int block) {
        assert function != null;
        this.function = function;
        this.block = block;
        this.memoizedHashCode = function.hashCode() * 31 + block;
    }

    public FunctionId getFunction() {
        return function;
    }

    public int getBlock() {
        return block;
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof GlobalBasicBlock)) {
            return false;
        }
        GlobalBasicBlock other = (GlobalBasicBlock) obj;
        return block == other.block && function.equals(other.function);
    }

    @Override
    public String toString() {
        return function + "@bb" + block;
    }
}
