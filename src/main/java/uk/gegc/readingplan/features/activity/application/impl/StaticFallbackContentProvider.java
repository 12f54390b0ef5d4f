package uk.gegc.readingplan.features.activity.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.readingplan.features.activity.application.FallbackContentProvider;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

@Component
@RequiredArgsConstructor
public class StaticFallbackContentProvider implements FallbackContentProvider {

    private final ObjectMapper objectMapper;

    @Override
    public JsonNode fallback(ActivityType type, int studentAge) {
        ObjectNode content = switch (type) {
            case WHO -> who();
            case WHERE -> where();
            case SEQUENCE -> sequence();
            case MAIN_IDEA -> mainIdea();
            case VOCABULARY -> vocabulary(studentAge);
            case PREDICT -> predict();
        };
        content.put("readingLevel", readingLevel(studentAge));
        content.put("fallback", true);
        return content;
    }

    private ObjectNode who() {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode real = root.putArray("realCharacters");
        real.addObject().put("name", "Alex").put("description", "The main character of the story").put("role", "protagonist");
        real.addObject().put("name", "Sam").put("description", "Alex's loyal best friend").put("role", "friend");
        ArrayNode decoys = root.putArray("decoyCharacters");
        decoys.addObject().put("name", "Captain Storm").put("description", "A pirate who never appears in this chapter");
        return root;
    }

    private ObjectNode where() {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode real = root.putArray("realSettings");
        real.addObject().put("name", "The Park").put("description", "A sunny park with tall trees and a pond");
        real.addObject().put("name", "Alex's House").put("description", "A cosy home at the end of the street");
        ArrayNode decoys = root.putArray("decoySettings");
        decoys.addObject().put("name", "The Moon Base").put("description", "A station on the moon that is not in this chapter");
        return root;
    }

    private ObjectNode sequence() {
        String[] events = {
                "Alex wakes up and decides to go on an adventure",
                "Alex meets Sam at the park",
                "The friends discover something surprising",
                "They work together to solve the problem"
        };
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode ordered = root.putArray("orderedEvents");
        for (int i = 0; i < events.length; i++) {
            ordered.addObject().put("id", i + 1).put("text", events[i]).put("order", i + 1);
        }
        ArrayNode shuffled = root.putArray("shuffledEvents");
        for (int id : new int[]{3, 1, 4, 2}) {
            shuffled.addObject().put("id", id).put("text", events[id - 1]);
        }
        return root;
    }

    private ObjectNode mainIdea() {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("question", "What is the main idea of this chapter?");
        ArrayNode options = root.putArray("options");
        addOption(options, 0, "Friends can solve problems by working together", true,
                "Yes! The characters succeed because they help each other.");
        addOption(options, 1, "Parks are good places to play", false,
                "The park is a setting, but it is not the main idea.");
        addOption(options, 2, "Waking up early is important", false,
                "This happens in the chapter but is only a small detail.");
        addOption(options, 3, "Pirates are scary", false,
                "Pirates are not part of this chapter.");
        return root;
    }

    private void addOption(ArrayNode options, int id, String text, boolean correct, String feedback) {
        options.addObject()
                .put("id", id)
                .put("text", text)
                .put("isCorrect", correct)
                .put("feedback", feedback);
    }

    private ObjectNode vocabulary(int studentAge) {
        boolean younger = studentAge < 9;
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode words = root.putArray("vocabularyWords");
        words.addObject()
                .put("word", "brave")
                .put("definition", younger ? "Not afraid to do something hard" : "Ready to face danger or difficulty")
                .put("context", "Alex was brave when the path got dark.");
        words.addObject()
                .put("word", "curious")
                .put("definition", younger ? "Wanting to find out about things" : "Eager to learn or know something")
                .put("context", "Sam was curious about the strange sound.");
        words.addObject()
                .put("word", "discover")
                .put("definition", younger ? "To find something new" : "To find something for the first time")
                .put("context", "They hoped to discover where the map led.");
        ArrayNode decoys = root.putArray("decoyDefinitions");
        decoys.addObject().put("definition", "A large body of salt water").put("isUsed", false);
        decoys.addObject().put("definition", "Feeling very sleepy").put("isUsed", false);
        return root;
    }

    private ObjectNode predict() {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("question", "What do you think will happen next?");
        ArrayNode predictions = root.putArray("predictions");
        addPrediction(predictions, "Alex and Sam will keep exploring together", 9,
                "Great thinking! The friends love adventures.");
        addPrediction(predictions, "They will find a new clue", 6,
                "That could happen. Look for clues in the next chapter.");
        addPrediction(predictions, "They will go home and forget the adventure", 4,
                "Possible, but the characters seem too curious for that.");
        addPrediction(predictions, "A dragon will carry them to the moon", 2,
                "That would be surprising! Nothing in the story points to it.");
        return root;
    }

    private void addPrediction(ArrayNode predictions, String text, int plausibility, String feedback) {
        predictions.addObject()
                .put("text", text)
                .put("plausibilityScore", plausibility)
                .put("feedback", feedback);
    }

    private String readingLevel(int studentAge) {
        if (studentAge < 9) {
            return "early";
        }
        return studentAge < 13 ? "middle" : "teen";
    }
}
