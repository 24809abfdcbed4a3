package com.musicinsights.playlistmerge.application.ingest;

/**
 * 하나 이상의 플레이리스트 ingest가 실패했음을 표현하는 예외.
 *
 * <p>성공한 플레이리스트까지 포함한 {@link IngestSummary}를 함께 보관한다.</p>
 */
public class IngestFailedException extends RuntimeException {
    private final IngestSummary summary;

    public IngestFailedException(IngestSummary summary) {
        super(summary.failures().size() + " playlist(s) failed to ingest: "
                + summary.failures().stream().map(IngestSummary.Failure::playlistId).toList());
        this.summary = summary;
    }

    public IngestSummary summary() {
        return summary;
    }

    /**
     * 에러 코드를 반환한다.
     *
     * @return 에러 코드
     */
    public String code() {
        return "INGEST_FAILED";
    }
}
