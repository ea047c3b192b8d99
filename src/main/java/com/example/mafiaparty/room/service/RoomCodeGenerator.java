package com.example.mafiaparty.room.service;

import com.example.mafiaparty.global.config.PartyProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Random;
import java.util.function.Predicate;

/**
 * 사람이 읽고 입력하기 쉬운 방 코드 생성기 (O/0/1/I 제외)
 */
@Component
public class RoomCodeGenerator {

    public static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    public static final int MAX_CODE_LENGTH = 8;

    private final PartyProperties.Room settings;
    private final Random random;

    @Autowired
    public RoomCodeGenerator(PartyProperties properties) {
        this(properties, new SecureRandom());
    }

    public RoomCodeGenerator(PartyProperties properties, Random random) {
        this.settings = properties.getRoom();
        this.random = random;
    }

    /**
     * 사용 중이지 않은 코드를 만든다. 기본 길이가 계속 충돌하면 긴 코드로 넘어간다.
     */
    public String generate(Predicate<String> inUse) {
        for (int i = 0; i < settings.getCodeAttempts(); i++) {
            String code = randomCode(settings.getCodeLength());
            if (!inUse.test(code)) {
                return code;
            }
        }
        String code;
        do {
            code = randomCode(settings.getFallbackCodeLength());
        } while (inUse.test(code));
        return code;
    }

    String randomCode(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    /**
     * 입력된 코드 정규화: 공백 제거, 대문자, 영숫자만, 최대 8자
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String code = raw.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
        return code.length() > MAX_CODE_LENGTH ? code.substring(0, MAX_CODE_LENGTH) : code;
    }
}
