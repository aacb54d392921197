package com.bbthechange.recurring.service;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JwtService Tests")
class JwtServiceTest {

    private static final String SECRET_KEY = "mySecretKeyForJWTTokenGenerationThatIsLongEnough123456789";
    private static final String USER_ID = "550e8400-e29b-41d4-a716-446655440000";

    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        jwtService = new JwtService();
        ReflectionTestUtils.setField(jwtService, "secretKey", SECRET_KEY);
        jwtService.init();
    }

    @Test
    void generateToken_RoundTripsUserId() {
        String token = jwtService.generateToken(USER_ID);

        assertTrue(jwtService.isTokenValid(token));
        assertEquals(USER_ID, jwtService.extractUserId(token));
    }

    @Test
    void isTokenValid_WithExpiredToken_ReturnsFalse() {
        SecretKey key = Keys.hmacShaKeyFor(SECRET_KEY.getBytes(StandardCharsets.UTF_8));
        String expired = Jwts.builder()
            .subject(USER_ID)
            .issuedAt(new Date(System.currentTimeMillis() - 7_200_000))
            .expiration(new Date(System.currentTimeMillis() - 3_600_000))
            .signWith(key)
            .compact();

        assertFalse(jwtService.isTokenValid(expired));
    }

    @Test
    void isTokenValid_WithTokenSignedByOtherKey_ReturnsFalse() {
        SecretKey otherKey = Keys.hmacShaKeyFor("anotherSecretKeyThatIsAlsoLongEnoughForHmac256".getBytes(StandardCharsets.UTF_8));
        String forged = Jwts.builder().subject(USER_ID).expiration(new Date(System.currentTimeMillis() + 60_000))
            .signWith(otherKey).compact();

        assertFalse(jwtService.isTokenValid(forged));
    }

    @Test
    void isTokenValid_WithGarbage_ReturnsFalse() {
        assertFalse(jwtService.isTokenValid("not.a.token"));
    }

    @Test
    void init_WithShortSecret_Throws() {
        JwtService weak = new JwtService();
        ReflectionTestUtils.setField(weak, "secretKey", "short");

        assertThrows(IllegalArgumentException.class, weak::init);
    }
}
