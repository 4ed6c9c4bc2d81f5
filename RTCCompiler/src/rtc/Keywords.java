package rtc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The vocabulary of trigger clauses: every surface form the {@link Tokenizer} recognizes, mapped
 * to its token kind.
 *
 * <p>Verbs register their present tense forms under one token ("enter" and "enters" are both
 * {@link TokenKind#ENTER}). Nouns register singular and plural; a noun written {@code "elf/elves"}
 * has an irregular plural, any other takes an "s". Keyword abilities and plane names that span
 * several words ("first strike", "serra's realm") are single entries and are matched before their
 * first word.
 *
 * <p>A word has exactly one kind. A counter type that is also a subtype or keyword ability
 * ("mine", "echo") keeps the other kind, and the counter grammar accepts it in counter position.
 */
public final class Keywords {

  public static final int MAX_PHRASE_WORDS = 3;

  private static final ImmutableList<String> COUNTER_TYPES =
      ImmutableList.of(
          "+1/+1", "-1/-1", "age", "aim", "arrow", "arrowhead", "awakening", "blaze", "blood",
          "bounty", "bribery", "carrion", "charge", "corpse", "credit", "cube", "currency", "death",
          "delay", "depletion", "devotion", "divinity", "doom", "dream", "echo", "elixir", "energy",
          "eon", "fade", "fate", "feather", "flood", "fungus", "fuse", "glyph", "gold", "growth",
          "hatchling", "healing", "hoofprint", "hourglass", "hunger", "ice", "infection",
          "intervention", "javelin", "ki", "level", "loyalty", "luck", "magnet", "mannequin",
          "matrix", "mine", "mining", "mire", "music", "net", "omen", "ore", "page", "pain",
          "paralyzation", "petal", "phylactery", "pin", "plague", "poison", "polyp", "pressure",
          "pupa", "quest", "rust", "scream", "shell", "shield", "shred", "sleep", "sleight", "soot",
          "spore", "storage", "strife", "study", "theft", "tide", "time", "tower", "training",
          "trap", "treasure", "velocity", "verse", "vitality", "wage", "winch", "wind", "wish");

  private static final ImmutableList<String> NUMBER_WORDS =
      ImmutableList.of(
          "zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine", "ten",
          "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen", "seventeen", "eighteen",
          "nineteen", "twenty");

  private static final ImmutableList<String> CREATURE_TYPES =
      ImmutableList.of(
          "advisor", "ally/allies", "angel", "anteater", "antelope", "ape", "archer", "archon",
          "artificer", "assassin", "assembly-worker", "atog", "aurochs/aurochs", "avatar", "badger",
          "barbarian", "basilisk", "bat", "bear", "beast", "beeble", "berserker", "bird",
          "blinkmoth", "boar", "bringer", "brushwagg", "camarid", "camel", "caribou/caribou",
          "carrier", "cat", "centaur", "cephalid", "chimera", "citizen", "cleric", "cockatrice",
          "construct", "coward", "crab", "crocodile", "cyclops/cyclops", "dauthi", "demon",
          "deserter", "devil", "djinn", "dragon", "drake", "dreadnought", "drone", "druid", "dryad",
          "dwarf/dwarves", "efreet", "elder", "eldrazi", "elemental", "elephant", "elf/elves",
          "elk", "eye", "faerie", "ferret", "fish/fish", "flagbearer", "fox/foxes", "frog",
          "fungus/fungi", "gargoyle", "germ", "giant", "gnome", "goat", "goblin", "golem", "gorgon",
          "graveborn", "gremlin", "griffin", "hag", "harpy/harpies", "hellion", "hippo",
          "hippogriff", "homarid", "homunculus/homunculi", "horror", "horse", "hound", "human",
          "hydra", "hyena", "illusion", "imp", "incarnation", "insect", "jellyfish/jellyfish",
          "juggernaut", "kavu", "kirin", "kithkin", "knight", "kobold", "kor", "kraken/kraken",
          "lammasu/lammasu", "leech/leeches", "leviathan", "lhurgoyf/lhurgoyfu", "licid", "lizard",
          "manticore", "masticore", "mercenary/mercenaries", "merfolk/merfolk", "metathran",
          "minion", "minotaur", "monger", "mongoose", "monk", "moonfolk/moonfolk", "mutant", "myr",
          "mystic", "nautilus/nautiluses", "nephilim", "nightmare", "nightstalker", "ninja",
          "noggle", "nomad", "octopus/octopi", "ogre", "ooze", "orb", "orc", "orgg", "ouphe",
          "ox/oxen", "oyster", "pegasus/pegasus", "pentavite", "pest", "phelddagrif",
          "phoenix/phoenix", "pincher", "pirate", "plant", "praetor", "prism", "rabbit", "rat",
          "rebel", "reflection", "rhino", "rigger", "rogue", "salamander", "samurai/samurai",
          "sand/sand", "saproling", "satyr", "scarecrow", "scorpion", "scout", "serf", "serpent",
          "shade", "shaman", "shapeshifter", "sheep/sheep", "siren", "skeleton", "slith", "sliver",
          "slug", "snake", "soldier", "soltari/soltari", "spawn/spawn", "specter", "spellshaper",
          "sphinx/sphinx", "spider", "spike", "spirit", "splinter", "sponge", "squid", "squirrel",
          "starfish/starfish", "surrakar", "survivor", "tetravite", "thalakos/thalakos", "thopter",
          "thrull", "treefolk/treefolk", "triskelavite", "troll", "turtle", "unicorn", "vampire",
          "vedalken", "viashino", "volver", "wall", "warrior", "weird", "werewolf/werewolves",
          "whale", "wizard", "wolf/wolves", "wolverine", "wombat", "worm", "wraith", "wurm",
          "yeti/yeti", "zombie", "zubera/zubera");

  // Artifact, enchantment, land and spell subtypes.
  private static final ImmutableList<String> NONCREATURE_TYPES =
      ImmutableList.of(
          "contraption", "equipment/equipment", "fortification", "aura", "curse", "shrine",
          "desert", "forest", "island", "lair", "locus/loci", "mine", "mountain", "plains/plains",
          "power-plant", "swamp", "tower", "trap");

  // Subtypes without a plural: planeswalker and plane names, "urza's", "arcane".
  private static final ImmutableList<String> NAMED_TYPES =
      ImmutableList.of(
          "urza's", "arcane", "ajani", "bolas", "chandra", "elspeth", "garruk", "gideon", "jace",
          "karn", "koth", "liliana", "nissa", "sarkhan", "sorin", "tezzeret", "venser", "alara",
          "arkhos", "bolas's meditation realm", "dominaria", "equilor", "iquatana", "ir",
          "kaldheim", "kamigawa", "karsus", "lorwyn", "luvion", "mercadia", "mirrodin", "moag",
          "muraganda", "phyrexia", "pyrulea", "rabiah", "rath", "ravnica", "segovia",
          "serra's realm", "shadowmoor", "shandalar", "ulgrotha", "valla", "wildfire", "zendikar");

  private static final ImmutableList<String> KEYWORD_ABILITIES =
      ImmutableList.of(
          "absorb", "affinity", "amplify", "annihilator", "aura swap", "banding", "battle cry",
          "bloodthirst", "bushido", "buyback", "cascade", "champion", "changeling", "conspire",
          "convoke", "cumulative upkeep", "cycling", "deathtouch", "defender", "delve", "devour",
          "double strike", "dredge", "echo", "enchant", "entwine", "epic", "equip", "evoke",
          "exalted", "fading", "fear", "first strike", "flanking", "flash", "flashback", "flying",
          "forecast", "fortify", "frenzy", "graft", "gravestorm", "haste", "haunt", "hexproof",
          "hideaway", "horsemanship", "indestructible", "infect", "intimidate", "kicker",
          "landwalk", "level", "level up", "lifelink", "living weapon", "madness", "modular",
          "morph", "multikicker", "ninjutsu", "offering", "persist", "phasing", "poisonous",
          "protection", "provoke", "prowl", "rampage", "reach", "rebound", "recover", "reinforce",
          "replicate", "retrace", "ripple", "shadow", "shroud", "soulshift", "splice",
          "split second", "storm", "sunburst", "suspend", "totem armor", "trample", "transfigure",
          "transmute", "typecycling", "unearth", "vanishing", "vigilance", "wither");

  private static final ImmutableList<String> QUALIFIERS =
      ImmutableList.of(
          "basic", "legendary", "snow", "world", "ongoing", "white", "blue", "black", "red",
          "green", "colorless", "colored", "monocolored", "multicolored", "attacking");

  private static final Keywords INSTANCE = buildTable();

  public static Keywords instance() {
    return INSTANCE;
  }

  private final ImmutableMap<String, TokenKind> kinds;
  private final ImmutableMap<String, Integer> values;

  private Keywords(ImmutableMap<String, TokenKind> kinds, ImmutableMap<String, Integer> values) {
    this.kinds = kinds;
    this.values = values;
  }

  public Optional<TokenKind> lookup(String words) {
    return Optional.ofNullable(kinds.get(words));
  }

  public Optional<Integer> numeralValue(String words) {
    return Optional.ofNullable(values.get(words));
  }

  public boolean contains(String words) {
    return kinds.containsKey(words);
  }

  private static Keywords buildTable() {
    Builder b = new Builder();

    // Verbs
    b.verb(TokenKind.ENTER, "enter", "enters");
    b.verb(TokenKind.LEAVE, "leave", "leaves");
    b.verb(TokenKind.DIE, "die", "dies");
    b.verb(TokenKind.PHASE, "phase", "phases");
    b.verb(TokenKind.PUT, "put", "puts");
    b.verb(TokenKind.IS, "is");
    b.verb(TokenKind.ARE, "are");
    b.verb(TokenKind.HAS, "has", "have");

    // Particles
    b.keyword(TokenKind.INTO, "into");
    b.keyword(TokenKind.ONTO, "onto");
    b.keyword(TokenKind.FROM, "from");
    b.keyword(TokenKind.ANYWHERE, "anywhere");
    b.keyword(TokenKind.IN, "in");
    b.keyword(TokenKind.OUT, "out");
    b.keyword(TokenKind.ON, "on");
    b.keyword(TokenKind.OR, "or");
    b.keyword(TokenKind.MORE, "more");
    b.keyword(TokenKind.FEWER, "fewer", "less");

    // Zones
    b.keyword(TokenKind.BATTLEFIELD, "battlefield");
    b.keyword(TokenKind.COMMAND, "command");
    b.keyword(TokenKind.EXILE, "exile");
    b.keyword(TokenKind.STACK, "stack");
    b.keyword(TokenKind.OUTSIDE, "outside");
    b.noun(TokenKind.GRAVEYARD, "graveyard", "graveyards");
    b.noun(TokenKind.HAND, "hand", "hands");
    b.noun(TokenKind.LIBRARY, "library", "libraries");
    b.noun(TokenKind.ZONE, "zone", "zones");
    b.noun(TokenKind.DECK, "deck", "decks");
    b.noun(TokenKind.SIDEBOARD, "sideboard", "sideboards");
    b.noun(TokenKind.GAME, "game", "games");
    b.noun(TokenKind.SUBGAME, "subgame", "subgames");

    // Object descriptions
    b.numeral(TokenKind.A, "a", 1);
    b.numeral(TokenKind.A, "an", 1);
    b.numeral(TokenKind.NO, "no", 0);
    b.keyword(
        TokenKind.DETERMINER,
        "the", "this", "that", "these", "those", "each", "target", "enchanted", "equipped");
    b.keyword(TokenKind.OTHER, "other", "another");
    b.keyword(TokenKind.NONTOKEN, "nontoken");
    b.keyword(
        TokenKind.PLAYER_POSS,
        "your", "their", "its", "owner's", "owners'", "controller's", "controllers'",
        "opponent's", "opponents'", "player's", "players'");
    QUALIFIERS.forEach(q -> b.keyword(TokenKind.QUALIFIER, q));
    b.nouns(
        TokenKind.OBJ_TYPE,
        ImmutableList.of(
            "artifact", "card", "creature", "enchantment", "instant", "land", "object",
            "permanent", "planeswalker", "sorcery/sorceries", "source", "spell", "token",
            "tribal/tribal"));
    b.nouns(TokenKind.OBJ_SUBTYPE, CREATURE_TYPES);
    b.nouns(TokenKind.OBJ_SUBTYPE, NONCREATURE_TYPES);
    NAMED_TYPES.forEach(t -> b.keyword(TokenKind.OBJ_SUBTYPE, t));
    b.keyword(TokenKind.SELF, "~", "it");

    KEYWORD_ABILITIES.forEach(k -> b.keyword(TokenKind.KEYWORD_ABILITY, k));

    // Counters
    b.noun(TokenKind.COUNTER, "counter", "counters");
    COUNTER_TYPES.forEach(b::counterType);
    for (int i = 0; i < NUMBER_WORDS.size(); i++) {
      b.numeral(TokenKind.NUMBER_WORD, NUMBER_WORDS.get(i), i);
    }

    return b.build();
  }

  private static final class Builder {
    private final Map<String, TokenKind> kinds = new LinkedHashMap<>();
    private final ImmutableMap.Builder<String, Integer> values = ImmutableMap.builder();

    void verb(TokenKind kind, String... presentForms) {
      keyword(kind, presentForms);
    }

    void noun(TokenKind kind, String singular, String plural) {
      keyword(kind, singular);
      if (!plural.equals(singular)) keyword(kind, plural);
    }

    // "sg" takes an "s" plural; "sg/pl" spells the plural out.
    void nouns(TokenKind kind, Iterable<String> entries) {
      for (String entry : entries) {
        List<String> forms = Splitter.on('/').splitToList(entry);
        noun(kind, forms.get(0), forms.size() > 1 ? forms.get(1) : forms.get(0) + "s");
      }
    }

    void keyword(TokenKind kind, String... words) {
      for (String word : words) {
        if (Splitter.on(' ').splitToList(word).size() > MAX_PHRASE_WORDS) {
          throw new IllegalArgumentException("phrase too long: " + word);
        }
        TokenKind previous = kinds.putIfAbsent(word, kind);
        Preconditions.checkArgument(
            previous == null, "'%s' is already a %s keyword", word, previous);
      }
    }

    void counterType(String word) {
      if (!kinds.containsKey(word)) keyword(TokenKind.COUNTER_TYPE, word);
    }

    void numeral(TokenKind kind, String word, int value) {
      keyword(kind, word);
      values.put(word, value);
    }

    Keywords build() {
      return new Keywords(ImmutableMap.copyOf(kinds), values.buildOrThrow());
    }
  }
}
