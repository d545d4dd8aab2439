package ir;

/**
 * Destructor invocation terminating a basic block
 */
public final class DropEffect {

    private final Place place;
    private final SourceLocation location;

    /**
     * Create a drop of the given place
     *
     * @param place place whose destructor runs
     * @param location source location of the drop
     */
    public DropEffect(Place place, SourceLocation location) {
        this.place = place;
        this.location = location;
    }

    public Place getPlace() {
        return place;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return "drop(" + place + ")";
    }
}
