package com.example.partyrooms;

import com.example.partyrooms.model.Difficulty;
import com.example.partyrooms.model.GameContent;
import com.example.partyrooms.model.GameMeta;
import com.example.partyrooms.persistence.RoomStore;
import com.example.partyrooms.prompt.PromptCodec;
import com.example.partyrooms.prompt.PromptKind;
import com.example.partyrooms.prompt.PromptPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.util.List;

@SpringBootApplication
public class PartyRoomsApplication {

    private static final Logger log = LoggerFactory.getLogger(PartyRoomsApplication.class);

    static final String DEMO_GAME_ID = "demo-quiz";

    public static void main(String[] args) {
        SpringApplication.run(PartyRoomsApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(name = "app.catalog.seed-demo", havingValue = "true")
    public CommandLineRunner seedDemoCatalog(RoomStore store) {
        return args -> {
            if (store.findGameMeta(DEMO_GAME_ID).isPresent()) {
                log.info("Demo catalog already present");
                return;
            }
            store.registerGame(new GameMeta(DEMO_GAME_ID, "Demo Quiz", 2, 12, true));

            List<GameContent> rows = List.of(
                question("geo-1", "geography", Difficulty.EASY, "Capital of Austria?", 1, "Graz", "Vienna", "Linz", "Salzburg"),
                question("geo-2", "geography", Difficulty.MEDIUM, "Longest river in Europe?", 2, "Danube", "Rhine", "Volga", "Elbe"),
                question("sci-1", "science", Difficulty.EASY, "Chemical symbol of gold?", 0, "Au", "Ag", "Gd", "Go"),
                question("sci-2", "science", Difficulty.HARD, "Which planet has the shortest day?", 2, "Earth", "Mars", "Jupiter", "Venus"),
                question("his-1", "history", Difficulty.MEDIUM, "Year the Berlin Wall fell?", 1, "1987", "1989", "1991"),
                question("his-2", "history", Difficulty.EASY, "First person on the Moon?", 2, "Gagarin", "Aldrin", "Armstrong")
            );
            rows.forEach(store::registerContent);
            log.info("Seeded demo catalog: game={}, prompts={}", DEMO_GAME_ID, rows.size());
        };
    }

    private static GameContent question(String id, String category, Difficulty difficulty,
                                        String text, int correctIndex, String... options) {
        String json = PromptCodec.encode(new PromptPayload.Question(text, List.of(options), correctIndex));
        return new GameContent(id, DEMO_GAME_ID, PromptKind.QUESTION, json, category, difficulty, true);
    }
}
