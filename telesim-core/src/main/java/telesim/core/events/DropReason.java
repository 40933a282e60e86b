package telesim.core.events;

public enum DropReason {
    BUFFER_OVERFLOW("buffer_overflow");

    private final String tag;

    DropReason(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
