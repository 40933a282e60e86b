package telesim.client.replay;

public record ReplaySummary(int sent, int failed, int skipped) {

    public int total() {
        return sent + failed + skipped;
    }
}
