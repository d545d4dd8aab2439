package ir;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;

/**
 * Control-flow IR of a single function
 */
public final class FunctionBody {

    private final FunctionId id;
    private final SortedMap<Integer, LocalInfo> locals;
    private final SortedMap<Integer, BasicBlock> blocks;

    /**
     * Create a function body
     *
     * @param id identifier of the function
     * @param locals local slot table keyed by index
     * @param blocks basic blocks keyed by index, the lowest index is the entry block
     */
    public FunctionBody(FunctionId id, SortedMap<Integer, LocalInfo> locals, SortedMap<Integer, BasicBlock> blocks) {
        if (blocks.isEmpty()) {
            throw new IllegalArgumentException("Function " + id + " has no basic blocks");
        }
        this.id = id;
        this.locals = Collections.unmodifiableSortedMap(locals);
        this.blocks = Collections.unmodifiableSortedMap(blocks);
    }

    public FunctionId getId() {
        return id;
    }

    public Collection<BasicBlock> getBlocks() {
        return blocks.values();
    }

    /**
     * Get the basic block with the given index
     *
     * @param block index of the block
     * @return the basic block
     * @throws IllegalStateException if there is no such block
     */
    public BasicBlock getBlock(int block) {
        BasicBlock bb = blocks.get(block);
        if (bb == null) {
            throw new IllegalStateException("No basic block bb" + block + " in " + id);
        }
        return bb;
    }

    /**
     * Index of the block where execution starts
     *
     * @return entry block index
     */
    public int getEntryBlock() {
        return blocks.firstKey();
    }

    public Collection<LocalInfo> getLocals() {
        return locals.values();
    }

    /**
     * Get the slot description for a local
     *
     * @param local local index
     * @return slot description or null if the local was not declared
     */
    public LocalInfo getLocal(int local) {
        return locals.get(local);
    }

    /**
     * Whether a drop of the given place agrees with the declared locals. Only a bare local that was declared as not
     * needing a drop disagrees; projected places and undeclared locals are always accepted.
     *
     * @param place dropped place
     * @return false if the front end said the local needs no drop
     */
    public boolean isDropExpected(Place place) {
        if (!place.getPath().isEmpty()) {
            return true;
        }
        LocalInfo info = locals.get(place.getLocal());
        return info == null || info.needsDrop();
    }

    /**
     * Source name of a local
     *
     * @param local local index
     * @return name or null for temporaries and undeclared locals
     */
    public String getLocalName(int local) {
        LocalInfo info = locals.get(local);
        return info == null ? null : info.getName();
    }

    /**
     * Declared type of a local
     *
     * @param local local index
     * @return type, {@link TypeDescriptor#UNKNOWN} if the local was not declared
     */
    public TypeDescriptor getLocalType(int local) {
        LocalInfo info = locals.get(local);
        return info == null ? TypeDescriptor.UNKNOWN : info.getType();
    }

    /**
     * Best known type of a place: the declared type of the local for a bare local, <code>reported</code> for a
     * projected place when the front end gave one
     *
     * @param place place to get the type of
     * @param reported type reported with the place, may be null
     * @return type of the place
     */
    public TypeDescriptor typeOf(Place place, TypeDescriptor reported) {
        if (reported != null) {
            return reported;
        }
        if (place.getPath().isEmpty()) {
            return getLocalType(place.getLocal());
        }
        return TypeDescriptor.UNKNOWN;
    }

    @Override
    public String toString() {
        return id.toString();
    }
}
