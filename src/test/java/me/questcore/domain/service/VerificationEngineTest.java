package me.questcore.domain.service;

import me.questcore.domain.model.CompletionCheck;
import me.questcore.domain.model.GeofenceTarget;
import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.TaskCategory;
import me.questcore.domain.model.VerificationResult;
import me.questcore.domain.model.VerificationType;
import me.questcore.infrastructure.config.QuestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VerificationEngineTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final double TARGET_LAT = 10.0;
    private static final double TARGET_LON = 20.0;

    private VerificationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new VerificationEngine(new QuestProperties(), Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldAcceptPhotoExactlyAtValidityLimit() {
        assertTrue(engine.isPhotoTimestampValid(FIXED_NOW.minusSeconds(300)));
    }

    @Test
    void shouldRejectPhotoOneSecondPastValidity() {
        assertFalse(engine.isPhotoTimestampValid(FIXED_NOW.minusSeconds(301)));
    }

    @Test
    void shouldTolerateSmallClockSkewIntoFuture() {
        assertTrue(engine.isPhotoTimestampValid(FIXED_NOW.plusSeconds(10)));
        assertFalse(engine.isPhotoTimestampValid(FIXED_NOW.plusSeconds(11)));
    }

    @Test
    void shouldRejectMissingPhotoTimestamp() {
        assertFalse(engine.isPhotoTimestampValid(null));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 100, 200, 500 })
    void shouldTreatCoincidentPointsAsInRange(double radius) {
        VerificationResult result = engine.verifyGeofence(TARGET_LAT, TARGET_LON, radius, TARGET_LAT, TARGET_LON);

        assertTrue(result.isInRange());
        assertEquals(0.0, result.getDistanceMeters(), 1e-6);
        assertEquals("0m", result.getDistanceText());
    }

    @ParameterizedTest
    @ValueSource(doubles = { 100, 200, 500 })
    void shouldTreatAntipodalPointAsOutOfRange(double radius) {
        VerificationResult result = engine.verifyGeofence(0, 0, radius, 0, 180);

        assertFalse(result.isInRange());
        assertEquals(Math.PI * VerificationEngine.EARTH_RADIUS_METERS, result.getDistanceMeters(), 1.0);
        assertEquals("20015.1 km", result.getDistanceText());
    }

    @ParameterizedTest
    @ValueSource(doubles = { 100, 200, 500 })
    void shouldIncludePointJustInsideRadius(double radius) {
        double[] user = northOf(radius - 1);

        VerificationResult result = engine.verifyGeofence(TARGET_LAT, TARGET_LON, radius, user[0], user[1]);

        assertTrue(result.isInRange());
        assertEquals(radius - 1, result.getDistanceMeters(), 0.01);
    }

    @ParameterizedTest
    @ValueSource(doubles = { 100, 200, 500 })
    void shouldExcludePointJustOutsideRadius(double radius) {
        double[] user = northOf(radius + 1);

        VerificationResult result = engine.verifyGeofence(TARGET_LAT, TARGET_LON, radius, user[0], user[1]);

        assertFalse(result.isInRange());
        assertEquals(radius + 1, result.getDistanceMeters(), 0.01);
    }

    @Test
    void shouldFormatKilometresWithOneDecimal() {
        assertEquals("999m", VerificationEngine.formatDistance(999.9));
        assertEquals("1.0 km", VerificationEngine.formatDistance(1000));
        assertEquals("12.3 km", VerificationEngine.formatDistance(12_345));
    }

    @Test
    void shouldReportUnknownDistanceWithoutCapturedLocation() {
        QuestTask task = QuestTask.builder()
                .verificationType(VerificationType.LOCATION)
                .geofence(GeofenceTarget.builder().latitude(TARGET_LAT).longitude(TARGET_LON).radiusMeters(100).build())
                .build();

        VerificationResult result = engine.verifyGeofence(task);

        assertFalse(result.isInRange());
        assertEquals("unknown", result.getDistanceText());
    }

    @Test
    void shouldFallBackToDefaultRadiusForUnsetGeofenceRadius() {
        double[] user = northOf(150);
        QuestTask task = QuestTask.builder()
                .verificationType(VerificationType.LOCATION)
                .geofence(GeofenceTarget.builder().latitude(TARGET_LAT).longitude(TARGET_LON).build())
                .verificationLatitude(user[0])
                .verificationLongitude(user[1])
                .build();

        VerificationResult result = engine.verifyGeofence(task);

        assertTrue(result.isInRange());
        assertEquals(200, result.getRadiusMeters());
    }

    @Test
    void shouldDetectMotionFromVaryingMagnitudes() {
        assertTrue(engine.detectMotion(List.of(9.0, 10.5, 9.2, 11.0, 8.7)));
    }

    @Test
    void shouldNotDetectMotionFromSteadyMagnitudes() {
        assertFalse(engine.detectMotion(List.of(9.81, 9.81, 9.81, 9.81)));
    }

    @Test
    void shouldNotDetectMotionFromTooFewSamples() {
        assertFalse(engine.detectMotion(List.of(1.0, 20.0)));
        assertFalse(engine.detectMotion(null));
    }

    @Test
    void shouldOnlyLookAtMostRecentWindow() {
        assertFalse(engine.detectMotion(List.of(0.0, 50.0, 9.81, 9.81, 9.81, 9.81, 9.81)));
    }

    @Test
    void shouldUseDefaultMinimumDurations() {
        assertEquals(0, engine.minimumDurationSeconds(task(VerificationType.NONE, TaskCategory.PHYSICAL)));
        assertEquals(60, engine.minimumDurationSeconds(task(VerificationType.PHOTO, TaskCategory.PHYSICAL)));
        assertEquals(300, engine.minimumDurationSeconds(task(VerificationType.LOCATION, TaskCategory.PHYSICAL)));
        assertEquals(120, engine.minimumDurationSeconds(task(VerificationType.LOCATION, TaskCategory.MENTAL)));
        assertEquals(120, engine.minimumDurationSeconds(task(VerificationType.LOCATION, TaskCategory.CREATIVE)));
        assertEquals(60, engine.minimumDurationSeconds(task(VerificationType.LOCATION, TaskCategory.SOCIAL)));
    }

    @Test
    void shouldPreferExplicitMinimumDuration() {
        QuestTask task = task(VerificationType.PHOTO, TaskCategory.PHYSICAL);
        task.setMinimumDurationSeconds(15);

        assertEquals(15, engine.minimumDurationSeconds(task));
    }

    @Test
    void shouldReportRemainingSecondsWhenTooEarly() {
        QuestTask task = task(VerificationType.LOCATION, TaskCategory.PHYSICAL);
        task.setStartedAt(FIXED_NOW.minusSeconds(100));

        CompletionCheck check = engine.checkMinimumDuration(task);

        assertFalse(check.isAllowed());
        assertEquals(200, check.getRemainingSeconds());
        assertEquals("Please wait 3m 20s before completing this task.", check.getReason());
    }

    @Test
    void shouldAllowCompletionAfterMinimumDuration() {
        QuestTask task = task(VerificationType.PHOTO, TaskCategory.HOUSEHOLD);
        task.setStartedAt(FIXED_NOW.minusSeconds(60));

        assertTrue(engine.checkMinimumDuration(task).isAllowed());
    }

    @Test
    void shouldRequireStartWhenDurationApplies() {
        CompletionCheck check = engine.checkMinimumDuration(task(VerificationType.PHOTO, TaskCategory.HOUSEHOLD));

        assertFalse(check.isAllowed());
        assertEquals("Start this task before completing it.", check.getReason());
    }

    @Test
    void shouldRequireFreshPhotoAsProof() {
        QuestTask task = task(VerificationType.PHOTO, TaskCategory.HOUSEHOLD);
        assertEquals("Take a photo to verify this task.", engine.checkProof(task).getReason());

        task.setPhotoData(new byte[] { 1, 2, 3 });
        task.setPhotoCapturedAt(FIXED_NOW.minusSeconds(400));
        assertEquals("Photo has expired. Please take a new one.", engine.checkProof(task).getReason());

        task.setPhotoCapturedAt(FIXED_NOW.minusSeconds(30));
        assertTrue(engine.checkProof(task).isAllowed());
    }

    @Test
    void shouldRequireCheckInForLocationProof() {
        QuestTask task = task(VerificationType.LOCATION, TaskCategory.PHYSICAL);

        assertEquals("Check in at the location to verify this task.", engine.checkProof(task).getReason());
    }

    @Test
    void shouldRejectCompletionAfterDeadline() {
        QuestTask task = task(VerificationType.NONE, TaskCategory.MENTAL);
        task.setDueDate(FIXED_NOW.minusSeconds(1));

        CompletionCheck check = engine.canComplete(task);

        assertFalse(check.isAllowed());
        assertEquals("The deadline for this task has passed.", check.getReason());
    }

    private static QuestTask task(VerificationType type, TaskCategory category) {
        return QuestTask.builder()
                .title("Task")
                .verificationType(type)
                .category(category)
                .build();
    }

    private static double[] northOf(double meters) {
        double deltaLat = Math.toDegrees(meters / VerificationEngine.EARTH_RADIUS_METERS);
        return new double[] { TARGET_LAT + deltaLat, TARGET_LON };
    }
}
