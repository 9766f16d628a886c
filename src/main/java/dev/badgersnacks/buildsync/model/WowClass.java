package dev.badgersnacks.buildsync.model;

import java.util.List;

/**
 * The playable classes together with the specialization slugs each one accepts.
 */
public enum WowClass {
    DEATH_KNIGHT("death-knight", "Death Knight", List.of("blood", "frost", "unholy")),
    DEMON_HUNTER("demon-hunter", "Demon Hunter", List.of("havoc", "vengeance")),
    DRUID("druid", "Druid", List.of("balance", "feral", "guardian", "restoration")),
    EVOKER("evoker", "Evoker", List.of("devastation", "preservation", "augmentation")),
    HUNTER("hunter", "Hunter", List.of("beast-mastery", "marksmanship", "survival")),
    MAGE("mage", "Mage", List.of("arcane", "fire", "frost")),
    MONK("monk", "Monk", List.of("brewmaster", "mistweaver", "windwalker")),
    PALADIN("paladin", "Paladin", List.of("holy", "protection", "retribution")),
    PRIEST("priest", "Priest", List.of("discipline", "holy", "shadow")),
    ROGUE("rogue", "Rogue", List.of("assassination", "outlaw", "subtlety")),
    SHAMAN("shaman", "Shaman", List.of("elemental", "enhancement", "restoration")),
    WARLOCK("warlock", "Warlock", List.of("affliction", "demonology", "destruction")),
    WARRIOR("warrior", "Warrior", List.of("arms", "fury", "protection"));

    private final String slug;
    private final String label;
    private final List<String> specializations;

    WowClass(String slug, String label, List<String> specializations) {
        this.slug = slug;
        this.label = label;
        this.specializations = specializations;
    }

    public String slug() {
        return slug;
    }

    public List<String> specializations() {
        return specializations;
    }

    public boolean hasSpecialization(String specSlug) {
        return specializations.contains(specSlug);
    }

    @Override
    public String toString() {
        return label;
    }
}
