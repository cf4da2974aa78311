package com.ryuqq.publisher.core.spi;

import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.model.Platform;
import com.ryuqq.publisher.core.model.PublishResult;
import com.ryuqq.publisher.core.model.ValidationResult;

import java.util.List;

/**
 * Per-destination format/validate/publish SPI.
 *
 * <p>Any method may throw; the orchestrator converts failures into
 * {@code DeliveryResult.error} and never lets them escape.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public interface PlatformAdapter {

    /**
     * @return the platform this adapter publishes to
     */
    Platform platform();

    /**
     * Checks the piece against platform rules.
     *
     * @param piece formatted piece
     * @return validation outcome
     */
    ValidationResult validateContent(ContentPiece piece);

    /**
     * Applies platform formatting.
     *
     * @param piece raw piece
     * @return piece with {@code formattedContent} set
     */
    ContentPiece formatContent(ContentPiece piece);

    /**
     * Publishes the piece.
     *
     * <p>Failures may be reported either as a failed {@link PublishResult} or as a thrown
     * exception; both are classified by message for retry purposes.</p>
     *
     * @param piece approved piece
     * @return publish outcome
     */
    PublishResult publishContent(ContentPiece piece);

    /**
     * @return true if the platform is reachable with current credentials
     */
    boolean checkConnection();

    /**
     * Trending topics for upstream planners. Not used by the delivery pipeline itself.
     *
     * @return trend list, empty by default
     */
    default List<String> getTrends() {
        return List.of();
    }
}
