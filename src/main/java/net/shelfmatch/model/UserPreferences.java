package net.shelfmatch.model;

/**
 * Free-text preference fields stored on the user row. Carried through profiles untouched.
 */
public record UserPreferences(String favoriteGenres, String favoriteAuthors, String favoriteBooks) {
}
