package com.infinitecanvas.canvasbackend.room;

import com.infinitecanvas.canvasbackend.error.CanvasException;

import java.util.List;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Room identifier policy and the generator behind room discovery.
 */
public final class RoomNames {
    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 50;

    private static final Pattern ALLOWED = Pattern.compile("^[A-Za-z0-9-]+$");

    private static final List<String> ADJECTIVES = List.of(
            "happy", "creative", "bright", "swift", "clever", "cool", "calm", "bold", "warm", "quick");
    private static final List<String> NOUNS = List.of(
            "canvas", "space", "room", "studio", "board", "place", "zone", "area", "lab", "hub");

    private RoomNames() {
    }

    public static boolean isValid(String roomName) {
        return roomName != null
                && roomName.length() >= MIN_LENGTH
                && roomName.length() <= MAX_LENGTH
                && ALLOWED.matcher(roomName).matches();
    }

    public static String requireValid(String roomName) {
        if (!isValid(roomName)) {
            throw CanvasException.invalidIdentifier(roomName);
        }
        return roomName;
    }

    /**
     * Human readable name such as {@code bright-studio-417}.
     */
    public static String generate(Random random) {
        return ADJECTIVES.get(random.nextInt(ADJECTIVES.size()))
                + "-" + NOUNS.get(random.nextInt(NOUNS.size()))
                + "-" + random.nextInt(1000);
    }
}
