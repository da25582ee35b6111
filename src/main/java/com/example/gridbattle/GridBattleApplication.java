package com.example.gridbattle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GridBattleApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridBattleApplication.class, args);
    }

}
