package io.mersel.ucdoc.application.enums;

/**
 * Senaryo × akış matrisinde bir akışın dal sınıflandırması.
 * <p>
 * Akışı içeren ilk senaryonun türüne göre belirlenir:
 * <ul>
 *   <li>{@link #NONE}: temel senaryoda, dal başlatmayan akış</li>
 *   <li>{@link #BRANCH}: temel senaryoda, en az bir alternatif/istisna akışının kaynağı</li>
 *   <li>{@link #ALTERNATE}: ilk kez bir alternatif akış senaryosunda görünen akış</li>
 *   <li>{@link #EXCEPTION}: ilk kez bir istisna akışı senaryosunda görünen akış</li>
 * </ul>
 */
public enum BranchType {
    NONE,
    BRANCH,
    ALTERNATE,
    EXCEPTION
}
