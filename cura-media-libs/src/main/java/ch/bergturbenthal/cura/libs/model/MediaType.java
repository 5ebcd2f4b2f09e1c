package ch.bergturbenthal.cura.libs.model;

public enum MediaType {
    IMAGE, VIDEO
}
