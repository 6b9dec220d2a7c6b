package org.changefeed.mongodb.nativedriver;

import org.bson.BsonDocument;
import org.bson.BsonString;
import org.changefeed.api.StringBasedResumePosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("MongoResumeTokenPosition")
@DisplayNameGeneration(ReplaceUnderscores.class)
class MongoResumeTokenPositionTest {
    private static final BsonDocument RESUME_TOKEN = new BsonDocument("_data", new BsonString("8263A1B2C3000000012B022C0100296E5A1004"));

    @Test
    void resume_token_is_read_back_from_the_string_representation() {
        // Given
        MongoResumeTokenPosition position = new MongoResumeTokenPosition(RESUME_TOKEN);

        // When
        BsonDocument resumeToken = MongoResumeTokenPosition.resumeTokenOf(new StringBasedResumePosition(position.asString()));

        // Then
        assertThat(resumeToken).isEqualTo(RESUME_TOKEN);
    }

    @Test
    void resume_token_document_is_accepted_as_is() {
        // When
        BsonDocument resumeToken = MongoResumeTokenPosition.resumeTokenOf(new StringBasedResumePosition(RESUME_TOKEN.toJson()));

        // Then
        assertThat(resumeToken).isEqualTo(RESUME_TOKEN);
    }

    @Test
    void positions_that_are_not_resume_tokens_are_rejected() {
        // When
        Throwable notJson = catchThrowable(() -> MongoResumeTokenPosition.resumeTokenOf(new StringBasedResumePosition("42")));
        Throwable otherDocument = catchThrowable(() -> MongoResumeTokenPosition.resumeTokenOf(new StringBasedResumePosition("{\"operationTime\": 1}")));

        // Then
        assertAll(
                () -> assertThat(notJson).isExactlyInstanceOf(IllegalArgumentException.class),
                () -> assertThat(otherDocument).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Resume position {\"operationTime\": 1} is not a MongoDB resume token")
        );
    }
}
