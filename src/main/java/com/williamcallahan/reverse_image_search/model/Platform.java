package com.williamcallahan.reverse_image_search.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Source platforms a search hit can be classified into
 *
 * @author William Callahan
 */
public enum Platform {
    DANBOORU("danbooru"),
    GELBOORU("gelbooru"),
    YANDERE("yandere"),
    KONACHAN("konachan"),
    SANKAKU("sankaku"),
    ZEROCHAN("zerochan"),
    THREE_D_BOORU("3dbooru"),
    E_SHUUSHUU("eshuushuu"),
    E621("e621"),
    PIXIV("pixiv"),
    TWITTER("twitter"),
    DEVIANTART("deviantart"),
    ARTSTATION("artstation"),
    PATREON("patreon"),
    MANGADEX("mangadex"),
    MANGAUPDATES("mangaupdates"),
    MYANIMELIST("myanimelist"),
    ANIDB("anidb"),
    ANILIST("anilist"),
    IMDB("imdb"),
    UNKNOWN("unknown");

    private static final Map<String, Platform> BY_ID = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Platform::getId, Function.identity()));

    private final String id;

    Platform(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Looks up a platform by its identifier, falling back to {@link #UNKNOWN}
     */
    public static Platform fromId(String id) {
        if (id == null) {
            return UNKNOWN;
        }
        return BY_ID.getOrDefault(id.trim().toLowerCase(), UNKNOWN);
    }
}
