package org.loreweave.runtime.model;

import java.util.function.Predicate;

/**
 * AND-combined entity filter used by {@link Graph#findEntities}. Unset fields match anything.
 */
public final class EntityCriteria implements Predicate<Entity> {

    private String kind;
    private String subtype;
    private String status;
    private String notStatus;
    private Prominence minProminence;
    private String tag;
    private String culture;

    public static EntityCriteria any() {
        return new EntityCriteria();
    }

    public static EntityCriteria kind(String kind) {
        return new EntityCriteria().withKind(kind);
    }

    public EntityCriteria withKind(String kind) { this.kind = kind; return this; }

    public EntityCriteria withSubtype(String subtype) { this.subtype = subtype; return this; }

    public EntityCriteria withStatus(String status) { this.status = status; return this; }

    public EntityCriteria withoutStatus(String status) { this.notStatus = status; return this; }

    public EntityCriteria withMinProminence(Prominence prominence) { this.minProminence = prominence; return this; }

    public EntityCriteria withTag(String tag) { this.tag = tag; return this; }

    public EntityCriteria withCulture(String culture) { this.culture = culture; return this; }

    @Override
    public boolean test(Entity e) {
        if (kind != null && !kind.equals(e.getKind())) return false;
        if (subtype != null && !subtype.equals(e.getSubtype())) return false;
        if (status != null && !status.equals(e.getStatus())) return false;
        if (notStatus != null && notStatus.equals(e.getStatus())) return false;
        if (minProminence != null && !e.getProminence().isAtLeast(minProminence)) return false;
        if (tag != null && !e.getTags().has(tag)) return false;
        if (culture != null && !culture.equals(e.getCulture())) return false;
        return true;
    }
}
