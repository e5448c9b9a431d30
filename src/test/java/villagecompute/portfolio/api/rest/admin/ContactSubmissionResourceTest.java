package villagecompute.portfolio.api.rest.admin;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.security.TestSecurity;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.portfolio.data.models.SubmissionAttempt;
import villagecompute.portfolio.data.models.SubmissionOutcome;

import java.time.Duration;
import java.time.Instant;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the admin submission audit endpoints.
 */
@QuarkusTest
class ContactSubmissionResourceTest {

    @BeforeEach
    @Transactional
    void setUp() {
        SubmissionAttempt.deleteAll();
    }

    private void insertAttempt(String ip, String email, SubmissionOutcome outcome, Instant submittedAt) {
        QuarkusTransaction.requiringNew()
                .run(() -> SubmissionAttempt.create(ip, email, outcome, "Mozilla/5.0", submittedAt));
    }

    @Test
    @TestSecurity(
            user = "owner",
            roles = "admin")
    void testListAttempts_FilterByIp() {
        Instant now = Instant.now();
        insertAttempt("203.0.113.100", "a@example.com", SubmissionOutcome.ACCEPTED, now.minusSeconds(60));
        insertAttempt("203.0.113.100", "a@example.com", SubmissionOutcome.BLOCKED, now.minusSeconds(10));
        insertAttempt("203.0.113.101", "b@example.com", SubmissionOutcome.ACCEPTED, now);

        given().queryParam("ip_address", "203.0.113.100").when().get("/admin/api/contact-submissions").then()
                .statusCode(200).body("size()", equalTo(2)).body("[0].outcome", equalTo("blocked"))
                .body("ip_address", everyItem(equalTo("203.0.113.100")));
    }

    @Test
    @TestSecurity(
            user = "owner",
            roles = "admin")
    void testListAttempts_FilterByEmailAndLimit() {
        Instant now = Instant.now();
        for (int i = 0; i < 5; i++) {
            insertAttempt("198.51.100." + i, "same@example.com", SubmissionOutcome.ACCEPTED, now.minusSeconds(i));
        }

        given().queryParam("email", "same@example.com").queryParam("limit", 3).when()
                .get("/admin/api/contact-submissions").then().statusCode(200).body("size()", equalTo(3));
    }

    @Test
    @TestSecurity(
            user = "owner",
            roles = "admin")
    void testPurge_DeletesOldAttempts() {
        Instant now = Instant.now();
        insertAttempt("203.0.113.102", null, SubmissionOutcome.ACCEPTED, now.minus(Duration.ofDays(45)));
        insertAttempt("203.0.113.103", null, SubmissionOutcome.ACCEPTED, now.minus(Duration.ofDays(2)));

        given().queryParam("days", 30).when().post("/admin/api/contact-submissions/purge").then().statusCode(200)
                .body("days", equalTo(30)).body("deleted_count", equalTo(1));

        assertEquals(1, SubmissionAttempt.count());
    }

    @Test
    @TestSecurity(
            user = "owner",
            roles = "admin")
    void testPurge_InvalidDays_Returns400() {
        given().queryParam("days", 0).when().post("/admin/api/contact-submissions/purge").then().statusCode(400);
    }

    @Test
    @TestSecurity(
            user = "visitor",
            roles = "user")
    void testPurge_WithoutAdminRole_Forbidden() {
        given().queryParam("days", 30).when().post("/admin/api/contact-submissions/purge").then().statusCode(403);
    }
}
