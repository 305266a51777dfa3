package me.golemcore.context.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * Context entry id helpers.
 *
 * <p>
 * Contract: {@code ^ctx_[A-Za-z0-9]{8}$}
 */
public final class ContextIdSupport {

    public static final String PREFIX = "ctx_";

    private static final Pattern ID_PATTERN = Pattern.compile("^ctx_[A-Za-z0-9]{8}$");
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int SUFFIX_LENGTH = 8;
    private static final SecureRandom RANDOM = new SecureRandom();

    private ContextIdSupport() {
    }

    public static boolean isValid(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }

    public static String generate() {
        StringBuilder sb = new StringBuilder(PREFIX.length() + SUFFIX_LENGTH).append(PREFIX);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
