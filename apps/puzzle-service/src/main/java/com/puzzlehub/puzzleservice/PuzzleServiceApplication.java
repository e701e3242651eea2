package com.puzzlehub.puzzleservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * puzzle-service 启动入口。
 */
@SpringBootApplication
public class PuzzleServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PuzzleServiceApplication.class, args);
    }
}
