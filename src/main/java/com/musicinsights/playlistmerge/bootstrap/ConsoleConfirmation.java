package com.musicinsights.playlistmerge.bootstrap;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * 표준 입력으로 y/N 확인을 받는다. 입력이 없으면 거절로 본다.
 */
@Component
public class ConsoleConfirmation implements Confirmation {

    @Override
    public boolean confirm(String question) {
        System.out.print(question + " [y/N] ");
        System.out.flush();
        try {
            String line = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)).readLine();
            return line != null && (line.trim().equalsIgnoreCase("y") || line.trim().equalsIgnoreCase("yes"));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read confirmation", e);
        }
    }
}
