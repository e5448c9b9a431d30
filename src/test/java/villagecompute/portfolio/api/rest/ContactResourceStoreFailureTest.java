package villagecompute.portfolio.api.rest;

import io.quarkus.mailer.MockMailbox;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.portfolio.exceptions.ContactStoreException;
import villagecompute.portfolio.services.ContactSubmission;
import villagecompute.portfolio.services.ContactSubmissionPipeline;

import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * A message that cannot be stored surfaces as 503 without notifying anyone.
 */
@QuarkusTest
class ContactResourceStoreFailureTest {

    private static final String BROWSER = "Mozilla/5.0 (X11; Linux x86_64) Gecko/20100101 Firefox/128.0";

    @InjectMock
    ContactSubmissionPipeline pipeline;

    @Inject
    MockMailbox mailbox;

    @BeforeEach
    void setUp() {
        mailbox.clear();
    }

    @Test
    void testSubmit_MessageStoreDown_Returns503() {
        when(pipeline.process(any(ContactSubmission.class)))
                .thenThrow(new ContactStoreException("Failed to store contact message", new RuntimeException("down")));

        given().contentType(ContentType.JSON).header("User-Agent", BROWSER).header("X-Forwarded-For", "203.0.113.44")
                .body(Map.of("name", "Jane Doe", "email", "jane@example.com", "subject", "Hi", "message",
                        "Hello there, could we talk about a small project next week?"))
                .when().post("/api/contact").then().statusCode(503).body("status", equalTo("rejected"))
                .body("message", containsString("could not be saved"));

        verify(pipeline, times(1)).process(any(ContactSubmission.class));
        assertEquals(0, mailbox.getTotalMessagesSent());
    }
}
